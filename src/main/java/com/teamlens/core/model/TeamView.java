package com.teamlens.core.model;

import java.util.List;
import java.util.Map;

/**
 * Externally visible form of a {@link Team}: deleted and internal tasks are dropped.
 */
public record TeamView(
    String name,
    TeamConfig config,
    Map<String, List<InboxMessage>> inboxes,
    List<TeamTask> tasks
) {

    public static TeamView of(Team team) {
        return new TeamView(team.name(), team.config(), team.inboxes(), team.visibleTasks());
    }
}
