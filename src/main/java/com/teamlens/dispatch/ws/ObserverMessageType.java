package com.teamlens.dispatch.ws;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of messages sent to observers.
 */
public enum ObserverMessageType {
    SNAPSHOT("snapshot"),
    TEAM_UPDATE("team_update"),
    HEARTBEAT("heartbeat"),
    HISTORY("history"),
    SESSION_DETAIL("session_detail"),
    ERROR("error");

    private final String wireName;

    ObserverMessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
