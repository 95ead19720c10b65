package com.teamlens.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamlens.core.model.InboxMessage;
import com.teamlens.core.model.MessageType;

/**
 * Derives the classification of an inbox message from its body.
 * <p>
 * A body that parses as a JSON object whose {@code type} field names a known
 * {@link MessageType} is structured: the type becomes the classification and the parsed
 * object is kept as payload. Everything else is plain text without payload.
 */
public class MessageClassifier {

    private static final String DISCRIMINATOR = "type";

    private final ObjectMapper objectMapper;

    public MessageClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InboxMessage enrich(String from, String text, String timestamp, String color, boolean read) {
        JsonNode structured = parseStructured(text);
        MessageType type = structured == null
                ? MessageType.PLAIN_TEXT
                : MessageType.fromDiscriminator(structured.get(DISCRIMINATOR).asText()).orElseThrow();
        return new InboxMessage(from, text, timestamp, color, read, type, structured);
    }

    /**
     * Returns the parsed body when it is a structured message, otherwise {@code null}.
     */
    JsonNode parseStructured(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode discriminator = node.get(DISCRIMINATOR);
        if (discriminator == null || !discriminator.isTextual()) {
            return null;
        }
        return MessageType.fromDiscriminator(discriminator.asText()).isPresent() ? node : null;
    }
}
