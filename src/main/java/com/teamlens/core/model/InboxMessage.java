package com.teamlens.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A message in an agent's inbox, enriched at ingestion with its classification.
 *
 * @param from        sending agent name
 * @param text        raw body; may itself be JSON
 * @param timestamp   ISO-8601 send time as written by the runtime
 * @param color       sender display color
 * @param read        whether the recipient has read it
 * @param messageType derived classification, {@link MessageType#PLAIN_TEXT} unless the body is structured
 * @param payload     parsed body when structured, otherwise {@code null}
 */
public record InboxMessage(
    String from,
    String text,
    String timestamp,
    String color,
    boolean read,
    MessageType messageType,
    JsonNode payload
) {

    public InboxMessage {
        messageType = messageType == null ? MessageType.PLAIN_TEXT : messageType;
    }

    public boolean isStructured() {
        return payload != null;
    }
}
