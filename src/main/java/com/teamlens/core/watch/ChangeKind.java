package com.teamlens.core.watch;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of watched file a path refers to.
 */
public enum ChangeKind {
    TEAM_CONFIG("config"),
    INBOX("inbox"),
    TASK("task"),
    IGNORED("ignored");

    private final String wireName;

    ChangeKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
