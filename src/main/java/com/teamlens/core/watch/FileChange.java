package com.teamlens.core.watch;

import java.nio.file.Path;

/**
 * A classified filesystem change.
 *
 * @param kind      classification of the path
 * @param path      the changed file
 * @param teamName  team the file belongs to, {@code null} when ignored
 * @param agentName inbox owner for {@link ChangeKind#INBOX}, otherwise {@code null}
 * @param taskId    task id for {@link ChangeKind#TASK}, otherwise {@code null}
 */
public record FileChange(
    ChangeKind kind,
    Path path,
    String teamName,
    String agentName,
    String taskId
) {

    public static FileChange teamConfig(Path path, String teamName) {
        return new FileChange(ChangeKind.TEAM_CONFIG, path, teamName, null, null);
    }

    public static FileChange inbox(Path path, String teamName, String agentName) {
        return new FileChange(ChangeKind.INBOX, path, teamName, agentName, null);
    }

    public static FileChange task(Path path, String teamName, String taskId) {
        return new FileChange(ChangeKind.TASK, path, teamName, null, taskId);
    }

    public static FileChange ignored(Path path) {
        return new FileChange(ChangeKind.IGNORED, path, null, null, null);
    }

    public boolean isRelevant() {
        return kind != ChangeKind.IGNORED;
    }
}
