package com.teamlens.core.events;

import com.teamlens.core.model.Team;
import com.teamlens.core.watch.ChangeKind;

import java.time.Instant;

/**
 * Description of one successful merge into the in-memory model.
 *
 * @param teamName  the team that changed
 * @param kind      which part of the team changed
 * @param team      full team state right after the merge
 * @param agentName inbox owner for inbox changes, otherwise {@code null}
 * @param taskId    task id for task changes, otherwise {@code null}
 * @param timestamp when the merge happened
 */
public record TeamChange(
    String teamName,
    ChangeKind kind,
    Team team,
    String agentName,
    String taskId,
    Instant timestamp
) {

    public static TeamChange config(Team team) {
        return new TeamChange(team.name(), ChangeKind.TEAM_CONFIG, team, null, null, Instant.now());
    }

    public static TeamChange inbox(Team team, String agentName) {
        return new TeamChange(team.name(), ChangeKind.INBOX, team, agentName, null, Instant.now());
    }

    public static TeamChange task(Team team, String taskId) {
        return new TeamChange(team.name(), ChangeKind.TASK, team, null, taskId, Instant.now());
    }

    /**
     * The changed data as observers see it: the new config, the new inbox, or the
     * visible task list.
     */
    public Object payload() {
        return switch (kind) {
            case TEAM_CONFIG -> team.config();
            case INBOX -> team.inboxes().get(agentName);
            case TASK -> team.visibleTasks();
            case IGNORED -> null;
        };
    }
}
