package com.teamlens.core.model;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable in-memory state of one team: its latest config, every agent inbox and every task.
 * <p>
 * Each {@code with*} method returns a new instance so that readers holding an older
 * {@code Team} never observe a partial merge.
 *
 * @param name    team name taken from the watched directory name
 * @param config  latest successfully parsed config, {@code null} until one has been read
 * @param inboxes agent name to full inbox contents
 * @param tasks   task id to task, including deleted and internal tasks
 */
public record Team(
    String name,
    TeamConfig config,
    Map<String, List<InboxMessage>> inboxes,
    Map<String, TeamTask> tasks
) {

    /** Orders numeric ids numerically ("2" before "10"), everything else lexically after. */
    public static final Comparator<String> TASK_ID_ORDER = (a, b) -> {
        Long left = numericId(a);
        Long right = numericId(b);
        if (left != null && right != null) {
            return Long.compare(left, right);
        }
        if (left != null) return -1;
        if (right != null) return 1;
        return a.compareTo(b);
    };

    public Team {
        inboxes = Map.copyOf(inboxes);
        tasks = Map.copyOf(tasks);
    }

    public static Team empty(String name) {
        return new Team(name, null, Map.of(), Map.of());
    }

    public Team withConfig(TeamConfig newConfig) {
        return new Team(name, newConfig, inboxes, tasks);
    }

    public Team withInbox(String agentName, List<InboxMessage> messages) {
        var updated = new LinkedHashMap<>(inboxes);
        updated.put(agentName, List.copyOf(messages));
        return new Team(name, config, updated, tasks);
    }

    public Team withTask(String taskId, TeamTask task) {
        var updated = new LinkedHashMap<>(tasks);
        updated.put(taskId, task);
        return new Team(name, config, inboxes, updated);
    }

    /**
     * Tasks that may be shown outside the aggregator, ordered by id.
     */
    public List<TeamTask> visibleTasks() {
        return tasks.entrySet().stream()
                .filter(e -> e.getValue().isVisible())
                .sorted(Map.Entry.comparingByKey(TASK_ID_ORDER))
                .map(Map.Entry::getValue)
                .toList();
    }

    private static Long numericId(String id) {
        if (id == null || id.isEmpty() || id.length() > 18) {
            return null;
        }
        for (int i = 0; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                return null;
            }
        }
        return Long.parseLong(id);
    }
}
