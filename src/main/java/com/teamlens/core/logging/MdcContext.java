package com.teamlens.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Teamlens-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTeam(String team) {
        MDC.put("team", team);
    }

    public static void setAgent(String team, String agent) {
        MDC.put("team", team);
        MDC.put("agent", agent);
    }

    public static void setTask(String team, String taskId) {
        MDC.put("team", team);
        MDC.put("taskId", taskId);
    }

    public static void clear() {
        MDC.remove("team");
        MDC.remove("agent");
        MDC.remove("taskId");
    }
}
