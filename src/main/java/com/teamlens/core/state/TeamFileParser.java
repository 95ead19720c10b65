package com.teamlens.core.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamlens.core.model.InboxMessage;
import com.teamlens.core.model.TaskStatus;
import com.teamlens.core.model.TeamConfig;
import com.teamlens.core.model.TeamTask;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and parses the three watched file formats.
 * <p>
 * The files are rewritten by an external process at any time, so a read can see a
 * missing or half-written file. Both cases surface as {@link ParseException}; callers keep
 * their previous value and wait for the next notification.
 */
public class TeamFileParser {

    private static final TypeReference<List<RawInboxMessage>> INBOX_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final MessageClassifier messageClassifier;

    public TeamFileParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.messageClassifier = new MessageClassifier(objectMapper);
    }

    public TeamConfig parseConfig(Path path) throws ParseException {
        TeamConfig config = read(path, objectMapper.constructType(TeamConfig.class));
        if (config == null) {
            throw new ParseException(path, false, "empty config");
        }
        if (config.createdAt() == null) {
            throw new ParseException(path, false, "config has no createdAt");
        }
        return config;
    }

    /**
     * Parses a whole inbox file and classifies every message in it.
     */
    public List<InboxMessage> parseInbox(Path path) throws ParseException {
        List<RawInboxMessage> raw = read(path, objectMapper.getTypeFactory().constructType(INBOX_TYPE));
        if (raw == null) {
            throw new ParseException(path, false, "empty inbox");
        }
        var messages = new ArrayList<InboxMessage>(raw.size());
        for (RawInboxMessage m : raw) {
            if (m == null) {
                continue;
            }
            messages.add(messageClassifier.enrich(m.from(), m.text(), m.timestamp(), m.color(),
                    Boolean.TRUE.equals(m.read())));
        }
        return messages;
    }

    /**
     * Parses a task file. {@code fallbackId} (the file name) is used when the file has no id.
     */
    public TeamTask parseTask(Path path, String fallbackId) throws ParseException {
        RawTask raw = read(path, objectMapper.constructType(RawTask.class));
        if (raw == null) {
            throw new ParseException(path, false, "empty task");
        }
        JsonNode metadata = raw.metadata();
        boolean internal = metadata != null && metadata.path("_internal").asBoolean(false);
        return new TeamTask(
                raw.id() != null && !raw.id().isBlank() ? raw.id() : fallbackId,
                raw.subject(),
                raw.description(),
                raw.activeForm(),
                Objects.requireNonNullElse(raw.status(), TaskStatus.PENDING),
                raw.owner(),
                raw.blocks(),
                raw.blockedBy(),
                internal
        );
    }

    private <T> T read(Path path, JavaType type) throws ParseException {
        String content;
        try {
            content = Files.readString(path);
        } catch (NoSuchFileException e) {
            throw new ParseException(path, true, "file not found");
        } catch (IOException e) {
            throw new ParseException(path, false, "read failed: " + e.getMessage());
        }
        if (content.isBlank()) {
            throw new ParseException(path, false, "file is empty");
        }
        try {
            return objectMapper.readValue(content, type);
        } catch (JsonProcessingException e) {
            throw new ParseException(path, false, e.getOriginalMessage());
        }
    }

    /**
     * A watched file could not be read or parsed.
     */
    public static class ParseException extends Exception {

        private final transient Path path;
        private final boolean missing;

        public ParseException(Path path, boolean missing, String reason) {
            super(path + ": " + reason);
            this.path = path;
            this.missing = missing;
        }

        public Path path() {
            return path;
        }

        /** {@code true} when the file did not exist at read time. */
        public boolean isMissing() {
            return missing;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RawInboxMessage(String from, String text, String timestamp, String color, Boolean read) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RawTask(
        String id,
        String subject,
        String description,
        String activeForm,
        TaskStatus status,
        String owner,
        List<String> blocks,
        List<String> blockedBy,
        JsonNode metadata
    ) {}
}
