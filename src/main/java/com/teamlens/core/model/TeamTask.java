package com.teamlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A task from {@code tasks/<team>/<id>.json}. Replaced wholesale on every change of its file.
 *
 * @param id          task id, unique within the team
 * @param subject     short title
 * @param description long-form description
 * @param activeForm  present-tense label shown while the task is in progress
 * @param status      current status
 * @param owner       agent name that owns the task, may be {@code null}
 * @param blocks      ids of tasks this one blocks
 * @param blockedBy   ids of tasks blocking this one
 * @param internal    set when the runtime marked the task {@code metadata._internal}
 */
public record TeamTask(
    String id,
    String subject,
    String description,
    String activeForm,
    TaskStatus status,
    String owner,
    List<String> blocks,
    List<String> blockedBy,
    boolean internal
) {

    public TeamTask {
        blocks = ids(blocks);
        blockedBy = ids(blockedBy);
    }

    /**
     * Deleted and internal tasks stay in the model but are hidden from every external listing.
     */
    public boolean isVisible() {
        return !internal && status != TaskStatus.DELETED;
    }

    private static List<String> ids(List<String> raw) {
        return raw == null ? List.of() : raw.stream().filter(Objects::nonNull).toList();
    }
}
