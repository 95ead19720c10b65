package com.teamlens.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTeam puts team in MDC")
    void setTeam() {
        MdcContext.setTeam("alpha");
        assertEquals("alpha", MDC.get("team"));
    }

    @Test
    @DisplayName("setAgent puts team and agent in MDC")
    void setAgent() {
        MdcContext.setAgent("alpha", "worker");
        assertEquals("alpha", MDC.get("team"));
        assertEquals("worker", MDC.get("agent"));
    }

    @Test
    @DisplayName("setTask puts team and taskId in MDC")
    void setTask() {
        MdcContext.setTask("alpha", "7");
        assertEquals("alpha", MDC.get("team"));
        assertEquals("7", MDC.get("taskId"));
    }

    @Test
    @DisplayName("clear removes all teamlens MDC keys and leaves others")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setAgent("alpha", "worker");
        MdcContext.setTask("alpha", "7");
        MdcContext.clear();
        assertNull(MDC.get("team"));
        assertNull(MDC.get("agent"));
        assertNull(MDC.get("taskId"));
        assertEquals("r-1", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
