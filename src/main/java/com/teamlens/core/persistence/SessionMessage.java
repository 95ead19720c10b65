package com.teamlens.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.teamlens.core.model.MessageType;

/**
 * An inbox message as persisted for a session, together with its recipient.
 */
public record SessionMessage(
    String recipient,
    String from,
    String text,
    String timestamp,
    String color,
    boolean read,
    MessageType messageType,
    JsonNode payload
) {}
