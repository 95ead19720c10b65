package com.teamlens.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamlens.core.model.InboxMessage;
import com.teamlens.core.model.MessageType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class MessageClassifierTest {

    private final MessageClassifier classifier = new MessageClassifier(new ObjectMapper());

    @Test
    @DisplayName("task assignment body is classified with its payload")
    void taskAssignment() {
        InboxMessage message = classifier.enrich("lead", "{\"type\":\"task_assignment\",\"taskId\":\"5\"}",
                "2026-01-05T10:00:00Z", "blue", false);

        assertEquals(MessageType.TASK_ASSIGNMENT, message.messageType());
        assertTrue(message.isStructured());
        assertEquals("5", message.payload().get("taskId").asText());
        assertEquals("lead", message.from());
        assertFalse(message.read());
    }

    @Test
    @DisplayName("plain string body is plain text without payload")
    void plainText() {
        InboxMessage message = classifier.enrich("lead", "hello", "2026-01-05T10:00:00Z", null, true);

        assertEquals(MessageType.PLAIN_TEXT, message.messageType());
        assertNull(message.payload());
        assertTrue(message.read());
    }

    @Test
    @DisplayName("every structured discriminator is recognised")
    void allDiscriminators() {
        assertEquals(MessageType.SHUTDOWN_REQUEST,
                classifier.enrich("a", "{\"type\":\"shutdown_request\"}", "t", null, false).messageType());
        assertEquals(MessageType.IDLE_NOTIFICATION,
                classifier.enrich("a", "{\"type\":\"idle_notification\",\"idleReason\":\"done\"}", "t", null, false).messageType());
        assertEquals(MessageType.SHUTDOWN_APPROVED,
                classifier.enrich("a", "  {\"type\":\"shutdown_approved\"}  ", "t", null, false).messageType());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"type\":\"unknown_kind\"}",
            "{\"type\":\"plain_text\"}",
            "{\"type\":5}",
            "{\"kind\":\"task_assignment\"}",
            "[{\"type\":\"task_assignment\"}]",
            "{\"type\":\"task_assignment\"",
            "\"task_assignment\"",
            ""
    })
    @DisplayName("bodies without a recognised discriminator are plain text")
    void unrecognisedBodies(String body) {
        InboxMessage message = classifier.enrich("a", body, "t", null, false);

        assertEquals(MessageType.PLAIN_TEXT, message.messageType());
        assertNull(message.payload());
    }

    @Test
    @DisplayName("null body is plain text")
    void nullBody() {
        assertNull(classifier.parseStructured(null));
        assertEquals(MessageType.PLAIN_TEXT, classifier.enrich("a", null, "t", null, false).messageType());
    }
}
