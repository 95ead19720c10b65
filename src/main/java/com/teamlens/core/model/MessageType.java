package com.teamlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Classification of an inbox message, derived from the {@code type} field of a JSON body.
 */
public enum MessageType {
    PLAIN_TEXT("plain_text"),
    TASK_ASSIGNMENT("task_assignment"),
    SHUTDOWN_REQUEST("shutdown_request"),
    IDLE_NOTIFICATION("idle_notification"),
    SHUTDOWN_APPROVED("shutdown_approved");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a structured-message discriminator. {@code plain_text} is not a discriminator
     * and never matches.
     */
    public static Optional<MessageType> fromDiscriminator(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MessageType type : values()) {
            if (type != PLAIN_TEXT && type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static MessageType fromWireName(String value) {
        for (MessageType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return PLAIN_TEXT;
    }
}
