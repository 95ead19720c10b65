package com.teamlens.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamlens.core.model.InboxMessage;
import com.teamlens.core.model.Member;
import com.teamlens.core.model.MessageType;
import com.teamlens.core.model.Team;
import com.teamlens.core.model.TaskStatus;
import com.teamlens.core.model.TeamConfig;
import com.teamlens.core.model.TeamTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable, idempotent mirror of team runs, keyed by (team name, config creation time).
 * <p>
 * Every write can be repeated any number of times with the same input:
 * <ul>
 *   <li>sessions are unique on {@code (team_name, created_at)}; a lost insert race is
 *       resolved by refetching the winner's row</li>
 *   <li>members are unique on {@code (session_id, agent_id)} and keep their first-seen values</li>
 *   <li>messages are unique on {@code (session_id, recipient, sender, timestamp)}</li>
 *   <li>tasks are keyed by {@code (session_id, task_id)} and fully replaced on every write</li>
 * </ul>
 * Uniqueness is enforced by the database, not by in-process locks, so the guarantees hold
 * for concurrent callers and for several processes sharing the file. Multi-row writes run
 * in a single transaction.
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private static final int MAX_ENSURE_ATTEMPTS = 3;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS sessions (
                id            INTEGER PRIMARY KEY AUTOINCREMENT,
                team_name     TEXT    NOT NULL,
                description   TEXT,
                lead_agent_id TEXT,
                created_at    INTEGER NOT NULL,
                started_at    INTEGER NOT NULL,
                ended_at      INTEGER,
                config_json   TEXT    NOT NULL,
                UNIQUE (team_name, created_at)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS session_members (
                id         INTEGER PRIMARY KEY AUTOINCREMENT,
                session_id INTEGER NOT NULL REFERENCES sessions(id),
                agent_id   TEXT    NOT NULL,
                name       TEXT,
                agent_type TEXT,
                model      TEXT,
                color      TEXT,
                joined_at  INTEGER,
                UNIQUE (session_id, agent_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS session_messages (
                id           INTEGER PRIMARY KEY AUTOINCREMENT,
                session_id   INTEGER NOT NULL REFERENCES sessions(id),
                recipient    TEXT    NOT NULL,
                sender       TEXT    NOT NULL,
                timestamp    TEXT    NOT NULL,
                text         TEXT,
                color        TEXT,
                is_read      INTEGER NOT NULL DEFAULT 0,
                message_type TEXT    NOT NULL,
                payload_json TEXT,
                UNIQUE (session_id, recipient, sender, timestamp)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS session_tasks (
                session_id      INTEGER NOT NULL REFERENCES sessions(id),
                task_id         TEXT    NOT NULL,
                subject         TEXT,
                description     TEXT,
                active_form     TEXT,
                status          TEXT    NOT NULL,
                owner           TEXT,
                blocks_json     TEXT    NOT NULL,
                blocked_by_json TEXT    NOT NULL,
                internal        INTEGER NOT NULL DEFAULT 0,
                updated_at      INTEGER NOT NULL,
                PRIMARY KEY (session_id, task_id)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_sessions_team_created ON sessions(team_name, created_at)",
            "CREATE INDEX IF NOT EXISTS idx_session_messages_session ON session_messages(session_id, timestamp)"
    );

    private static final String SELECT_SESSION_REF_SQL = """
            SELECT id FROM sessions WHERE team_name = ? AND created_at = ?
            """;

    private static final String INSERT_SESSION_SQL = """
            INSERT INTO sessions (team_name, description, lead_agent_id, created_at, started_at, config_json)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (team_name, created_at) DO NOTHING
            """;

    private static final String END_EARLIER_SESSIONS_SQL = """
            UPDATE sessions SET ended_at = ?
            WHERE team_name = ? AND created_at < ? AND ended_at IS NULL
            """;

    private static final String INSERT_MEMBER_SQL = """
            INSERT INTO session_members (session_id, agent_id, name, agent_type, model, color, joined_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id, agent_id) DO NOTHING
            """;

    private static final String INSERT_MESSAGE_SQL = """
            INSERT INTO session_messages
                (session_id, recipient, sender, timestamp, text, color, is_read, message_type, payload_json)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id, recipient, sender, timestamp) DO NOTHING
            """;

    private static final String UPSERT_TASK_SQL = """
            INSERT INTO session_tasks
                (session_id, task_id, subject, description, active_form, status, owner,
                 blocks_json, blocked_by_json, internal, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id, task_id)
            DO UPDATE SET subject = excluded.subject,
                          description = excluded.description,
                          active_form = excluded.active_form,
                          status = excluded.status,
                          owner = excluded.owner,
                          blocks_json = excluded.blocks_json,
                          blocked_by_json = excluded.blocked_by_json,
                          internal = excluded.internal,
                          updated_at = excluded.updated_at
            """;

    private static final String SUMMARY_COLUMNS = """
            SELECT s.id, s.team_name, s.description, s.created_at, s.started_at, s.ended_at, s.config_json,
                   (SELECT COUNT(*) FROM session_members m WHERE m.session_id = s.id) AS member_count,
                   (SELECT COUNT(*) FROM session_messages g WHERE g.session_id = s.id) AS message_count,
                   (SELECT COUNT(*) FROM session_tasks t
                     WHERE t.session_id = s.id AND t.internal = 0 AND t.status <> 'deleted') AS task_count
            FROM sessions s
            """;

    private static final String LIST_SESSIONS_SQL = SUMMARY_COLUMNS + " ORDER BY s.created_at DESC, s.id DESC";

    private static final String SELECT_SESSION_SQL = SUMMARY_COLUMNS + " WHERE s.id = ?";

    private static final String SELECT_MEMBERS_SQL = """
            SELECT agent_id, name, agent_type, model, color, joined_at
            FROM session_members WHERE session_id = ? ORDER BY id
            """;

    private static final String SELECT_MESSAGES_SQL = """
            SELECT recipient, sender, timestamp, text, color, is_read, message_type, payload_json
            FROM session_messages WHERE session_id = ? ORDER BY timestamp, id
            """;

    private static final String SELECT_TASKS_SQL = """
            SELECT task_id, subject, description, active_form, status, owner, blocks_json, blocked_by_json, internal
            FROM session_tasks
            WHERE session_id = ? AND internal = 0 AND status <> 'deleted'
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public SessionStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the session tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                st.execute(ddl);
            }
            log.info("Session tables ensured");
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to initialize session schema", e);
        }
    }

    // ── Writes ───────────────────────────────────────────────────────────

    /**
     * Returns the session for {@code (teamName, config.createdAt)}, creating it with a
     * serialized snapshot of {@code config} when it does not exist yet. Creating a session
     * ends any earlier open session of the same team name.
     */
    public SessionRef ensureSession(String teamName, TeamConfig config) {
        Objects.requireNonNull(config.createdAt(), "config.createdAt");
        String configJson = toJson(config);

        for (int attempt = 1; attempt <= MAX_ENSURE_ATTEMPTS; attempt++) {
            try (Connection conn = dataSource.getConnection()) {
                conn.setAutoCommit(false);
                try {
                    Optional<SessionRef> session = findOrCreateSession(conn, teamName, config, configJson);
                    conn.commit();
                    if (session.isPresent()) {
                        return session.get();
                    }
                } catch (SQLException | RuntimeException e) {
                    conn.rollback();
                    throw e;
                }
                log.debug("Session for team {} not visible after insert (attempt {}), retrying", teamName, attempt);
            } catch (SQLException e) {
                if (attempt == MAX_ENSURE_ATTEMPTS) {
                    throw new SessionStoreException("Failed to ensure session for team " + teamName, e);
                }
                log.debug("Ensure session for team {} failed (attempt {}): {}", teamName, attempt, e.getMessage());
            }
        }
        throw new SessionStoreException("Session for team " + teamName + " could not be created or found");
    }

    /** Insert and closing of earlier sessions share the caller's transaction. */
    private Optional<SessionRef> findOrCreateSession(Connection conn, String teamName, TeamConfig config,
                                                     String configJson) throws SQLException {
        long createdAt = config.createdAt();
        Optional<Long> existing = findSessionId(conn, teamName, createdAt);
        if (existing.isPresent()) {
            return Optional.of(new SessionRef(existing.get(), teamName, createdAt, false));
        }
        long now = System.currentTimeMillis();
        int inserted;
        try (PreparedStatement ps = conn.prepareStatement(INSERT_SESSION_SQL)) {
            ps.setString(1, teamName);
            ps.setString(2, config.description());
            ps.setString(3, config.leadAgentId());
            ps.setLong(4, createdAt);
            ps.setLong(5, now);
            ps.setString(6, configJson);
            inserted = ps.executeUpdate();
        }
        Optional<Long> id = findSessionId(conn, teamName, createdAt);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        if (inserted == 1) {
            endEarlierSessions(conn, teamName, createdAt, now);
            log.info("Created session {} for team {} (createdAt={})", id.get(), teamName, createdAt);
        } else {
            log.debug("Session for team {} (createdAt={}) created concurrently, reusing {}",
                    teamName, createdAt, id.get());
        }
        return Optional.of(new SessionRef(id.get(), teamName, createdAt, inserted == 1));
    }

    /**
     * Inserts every member not yet recorded for the session, as one atomic batch.
     *
     * @return number of newly inserted members
     */
    public int recordMembers(long sessionId, List<Member> members) {
        if (members.isEmpty()) {
            return 0;
        }
        return inTransaction("record members for session " + sessionId, conn -> {
            int inserted = 0;
            try (PreparedStatement ps = conn.prepareStatement(INSERT_MEMBER_SQL)) {
                for (Member member : members) {
                    String agentId = member.agentId() != null ? member.agentId() : member.name();
                    if (agentId == null) {
                        continue;
                    }
                    ps.setLong(1, sessionId);
                    ps.setString(2, agentId);
                    ps.setString(3, member.name());
                    ps.setString(4, member.agentType());
                    ps.setString(5, member.model());
                    ps.setString(6, member.color());
                    setNullableLong(ps, 7, member.joinedAt());
                    inserted += ps.executeUpdate();
                }
            }
            return inserted;
        });
    }

    /**
     * Inserts one message unless an identical (recipient, sender, timestamp) row exists.
     *
     * @return {@code true} if a row was inserted
     */
    public boolean recordMessage(long sessionId, String recipient, InboxMessage message) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_MESSAGE_SQL)) {
            return bindMessage(ps, sessionId, recipient, message) && ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to record message for session " + sessionId, e);
        }
    }

    /**
     * Records a whole inbox in one transaction; messages already present are skipped.
     *
     * @return number of newly inserted messages
     */
    public int recordInbox(long sessionId, String recipient, List<InboxMessage> messages) {
        if (messages.isEmpty()) {
            return 0;
        }
        return inTransaction("record inbox " + recipient + " for session " + sessionId, conn -> {
            int inserted = 0;
            try (PreparedStatement ps = conn.prepareStatement(INSERT_MESSAGE_SQL)) {
                for (InboxMessage message : messages) {
                    if (bindMessage(ps, sessionId, recipient, message)) {
                        inserted += ps.executeUpdate();
                    }
                }
            }
            return inserted;
        });
    }

    /**
     * Inserts the task or overwrites every field of the existing row for its id.
     */
    public void recordTask(long sessionId, TeamTask task) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPSERT_TASK_SQL)) {
            ps.setLong(1, sessionId);
            ps.setString(2, task.id());
            ps.setString(3, task.subject());
            ps.setString(4, task.description());
            ps.setString(5, task.activeForm());
            ps.setString(6, task.status().wireName());
            ps.setString(7, task.owner());
            ps.setString(8, toJson(task.blocks()));
            ps.setString(9, toJson(task.blockedBy()));
            ps.setInt(10, task.internal() ? 1 : 0);
            ps.setLong(11, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to record task " + task.id() + " for session " + sessionId, e);
        }
    }

    // ── Reads ────────────────────────────────────────────────────────────

    /**
     * History index, newest session first.
     */
    public List<SessionSummary> listSessions() {
        var sessions = new ArrayList<SessionSummary>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(LIST_SESSIONS_SQL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                sessions.add(summaryFrom(rs));
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to list sessions", e);
        }
        return sessions;
    }

    /**
     * Full detail of one session, or empty when no session has that id.
     */
    public Optional<SessionDetail> findSession(long sessionId) {
        try (Connection conn = dataSource.getConnection()) {
            SessionSummary summary;
            TeamConfig config;
            try (PreparedStatement ps = conn.prepareStatement(SELECT_SESSION_SQL)) {
                ps.setLong(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    summary = summaryFrom(rs);
                    config = fromJson(rs.getString("config_json"), TeamConfig.class);
                }
            }
            return Optional.of(new SessionDetail(
                    summary,
                    config,
                    loadMembers(conn, sessionId),
                    loadMessages(conn, sessionId),
                    loadTasks(conn, sessionId)));
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to load session " + sessionId, e);
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private Optional<Long> findSessionId(Connection conn, String teamName, long createdAt) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_SESSION_REF_SQL)) {
            ps.setString(1, teamName);
            ps.setLong(2, createdAt);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong("id")) : Optional.empty();
            }
        }
    }

    private void endEarlierSessions(Connection conn, String teamName, long createdAt, long now) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(END_EARLIER_SESSIONS_SQL)) {
            ps.setLong(1, now);
            ps.setString(2, teamName);
            ps.setLong(3, createdAt);
            int ended = ps.executeUpdate();
            if (ended > 0) {
                log.info("Ended {} earlier session(s) of team {}", ended, teamName);
            }
        }
    }

    /** Returns {@code false} when the message lacks the fields that identify it. */
    private boolean bindMessage(PreparedStatement ps, long sessionId, String recipient, InboxMessage message)
            throws SQLException {
        if (message.from() == null || message.timestamp() == null) {
            log.debug("Skipping message without sender or timestamp in inbox {}", recipient);
            return false;
        }
        ps.setLong(1, sessionId);
        ps.setString(2, recipient);
        ps.setString(3, message.from());
        ps.setString(4, message.timestamp());
        ps.setString(5, message.text());
        ps.setString(6, message.color());
        ps.setInt(7, message.read() ? 1 : 0);
        ps.setString(8, message.messageType().wireName());
        ps.setString(9, message.payload() != null ? toJson(message.payload()) : null);
        return true;
    }

    private List<Member> loadMembers(Connection conn, long sessionId) throws SQLException {
        var members = new ArrayList<Member>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_MEMBERS_SQL)) {
            ps.setLong(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    members.add(new Member(
                            rs.getString("agent_id"),
                            rs.getString("name"),
                            rs.getString("agent_type"),
                            rs.getString("model"),
                            rs.getString("color"),
                            getNullableLong(rs, "joined_at")));
                }
            }
        }
        return members;
    }

    private List<SessionMessage> loadMessages(Connection conn, long sessionId) throws SQLException {
        var messages = new ArrayList<SessionMessage>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_MESSAGES_SQL)) {
            ps.setLong(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String payload = rs.getString("payload_json");
                    messages.add(new SessionMessage(
                            rs.getString("recipient"),
                            rs.getString("sender"),
                            rs.getString("text"),
                            rs.getString("timestamp"),
                            rs.getString("color"),
                            rs.getInt("is_read") == 1,
                            MessageType.fromWireName(rs.getString("message_type")),
                            payload != null ? fromJson(payload, JsonNode.class) : null));
                }
            }
        }
        return messages;
    }

    private List<TeamTask> loadTasks(Connection conn, long sessionId) throws SQLException {
        var tasks = new ArrayList<TeamTask>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_TASKS_SQL)) {
            ps.setLong(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tasks.add(new TeamTask(
                            rs.getString("task_id"),
                            rs.getString("subject"),
                            rs.getString("description"),
                            rs.getString("active_form"),
                            TaskStatus.fromWireName(rs.getString("status")),
                            rs.getString("owner"),
                            fromJson(rs.getString("blocks_json"), STRING_LIST),
                            fromJson(rs.getString("blocked_by_json"), STRING_LIST),
                            rs.getInt("internal") == 1));
                }
            }
        }
        tasks.sort(Comparator.comparing(TeamTask::id, Team.TASK_ID_ORDER));
        return tasks;
    }

    private SessionSummary summaryFrom(ResultSet rs) throws SQLException {
        return new SessionSummary(
                rs.getLong("id"),
                rs.getString("team_name"),
                rs.getString("description"),
                rs.getLong("created_at"),
                rs.getLong("started_at"),
                getNullableLong(rs, "ended_at"),
                rs.getInt("member_count"),
                rs.getInt("message_count"),
                rs.getInt("task_count"));
    }

    private <T> T inTransaction(String action, TransactionalWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to " + action, e);
        }
    }

    @FunctionalInterface
    private interface TransactionalWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to deserialize stored JSON", e);
        }
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, java.sql.Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
