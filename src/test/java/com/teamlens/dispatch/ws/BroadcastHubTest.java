package com.teamlens.dispatch.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamlens.core.events.EventBus;
import com.teamlens.core.events.TeamChange;
import com.teamlens.core.metrics.TeamlensMetrics;
import com.teamlens.core.model.TaskStatus;
import com.teamlens.core.model.Team;
import com.teamlens.core.model.TeamConfig;
import com.teamlens.core.model.TeamTask;
import com.teamlens.core.model.TeamView;
import com.teamlens.core.model.TeamsSnapshot;
import com.teamlens.core.persistence.SessionDetail;
import com.teamlens.core.persistence.SessionStore;
import com.teamlens.core.persistence.SessionStoreException;
import com.teamlens.core.persistence.SessionSummary;
import com.teamlens.core.state.StateAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link BroadcastHub}.
 */
class BroadcastHubTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private StateAggregator aggregator;
    private SessionStore store;
    private SimpleMeterRegistry registry;
    private BroadcastProperties properties;
    private BroadcastHub hub;

    private final Team alpha = Team.empty("alpha")
            .withConfig(new TeamConfig("alpha", "Build it", 1000L, "lead@alpha", List.of()))
            .withTask("1", new TeamTask("1", "First", null, null, TaskStatus.PENDING, null, null, null, false));

    @BeforeEach
    void setUp() {
        aggregator = mock(StateAggregator.class);
        store = mock(SessionStore.class);
        registry = new SimpleMeterRegistry();
        properties = new BroadcastProperties();
        when(aggregator.snapshot()).thenReturn(new TeamsSnapshot(
                Map.of("alpha", TeamView.of(alpha), "beta", TeamView.of(Team.empty("beta"))), "alpha"));
        hub = new BroadcastHub(aggregator, store, new EventBus(), objectMapper, properties, new TeamlensMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        hub.shutdown();
    }

    private JsonNode message(RecordingChannel channel, int index) throws Exception {
        await().atMost(Duration.ofSeconds(5)).until(() -> channel.sent().size() > index);
        return objectMapper.readTree(channel.sent().get(index));
    }

    private RecordingChannel connect(String id) throws Exception {
        var channel = new RecordingChannel(id);
        hub.register(channel);
        assertEquals("snapshot", message(channel, 0).get("type").asText());
        return channel;
    }

    @Nested
    @DisplayName("connections")
    class Connections {

        @Test
        @DisplayName("a new observer receives the full snapshot first")
        void snapshotOnConnect() throws Exception {
            var channel = new RecordingChannel("o1");
            hub.register(channel);

            JsonNode snapshot = message(channel, 0);
            assertEquals("snapshot", snapshot.get("type").asText());
            assertEquals("alpha", snapshot.at("/payload/activeTeam").asText());
            assertEquals("First", snapshot.at("/payload/teams/alpha/tasks/0/subject").asText());
            assertTrue(snapshot.hasNonNull("timestamp"));
            assertEquals(1, hub.observerCount());
        }

        @Test
        @DisplayName("unregistering removes the observer")
        void unregister() throws Exception {
            connect("o1");

            hub.unregister("o1");
            hub.unregister("o1");

            assertEquals(0, hub.observerCount());
        }

        @Test
        @DisplayName("registration after shutdown closes the channel")
        void afterShutdown() {
            hub.shutdown();
            var channel = new RecordingChannel("late");

            hub.register(channel);

            assertEquals(1, channel.closeCount());
            assertEquals(0, hub.observerCount());
        }

        @Test
        @DisplayName("start registers the observer gauge and subscribes to changes")
        void start() throws Exception {
            EventBus bus = new EventBus();
            var started = new BroadcastHub(aggregator, store, bus, objectMapper, properties, new TeamlensMetrics(registry));
            started.start();
            try {
                var channel = new RecordingChannel("o1");
                started.register(channel);
                bus.publish(TeamChange.task(alpha, "1"));

                assertEquals("team_update", message(channel, 1).get("type").asText());
                assertEquals(1.0, registry.get("teamlens.observers.connected").gauge().value());
            } finally {
                started.shutdown();
            }
            assertEquals(0, bus.subscriberCount());
        }
    }

    @Nested
    @DisplayName("fan-out")
    class FanOut {

        @Test
        @DisplayName("every observer receives each team update")
        void everyObserver() throws Exception {
            var first = connect("o1");
            var second = connect("o2");

            hub.onChange(TeamChange.task(alpha, "1"));

            for (RecordingChannel channel : List.of(first, second)) {
                JsonNode update = message(channel, 1);
                assertEquals("team_update", update.get("type").asText());
                assertEquals("alpha", update.at("/payload/teamName").asText());
                assertEquals("task", update.at("/payload/changeKind").asText());
                assertEquals("1", update.at("/payload/taskId").asText());
                assertEquals("pending", update.at("/payload/data/0/status").asText());
            }
        }

        @Test
        @DisplayName("a blocked observer does not delay the others")
        void slowObserverIsolated() throws Exception {
            var slow = new RecordingChannel("slow").blocking();
            hub.register(slow);
            var fast = connect("fast");

            for (int i = 0; i < 5; i++) {
                hub.onChange(TeamChange.config(alpha));
            }

            await().atMost(Duration.ofSeconds(5)).until(() -> fast.sent().size() == 6);
            assertTrue(slow.sent().isEmpty());

            slow.release();
            await().atMost(Duration.ofSeconds(5)).until(() -> slow.sent().size() == 6);
        }

        @Test
        @DisplayName("an observer that falls too far behind is dropped")
        void backlogDropped() throws Exception {
            var healthy = connect("healthy");
            properties.setMaxPendingMessages(3);
            var stuck = new RecordingChannel("stuck").blocking();
            hub.register(stuck);

            for (int i = 0; i < 10; i++) {
                hub.onChange(TeamChange.config(alpha));
            }

            await().atMost(Duration.ofSeconds(5)).until(() -> hub.observerCount() == 1);
            assertEquals(1.0, registry.get("teamlens.observers.dropped").tag("reason", "backlog").counter().count());
            stuck.release();
            await().atMost(Duration.ofSeconds(5)).until(() -> healthy.sent().size() == 11);
        }

        @Test
        @DisplayName("an observer whose send fails is dropped")
        void failedSendDropped() {
            var broken = new RecordingChannel("broken").failing();
            hub.register(broken);

            await().atMost(Duration.ofSeconds(5)).until(() -> hub.observerCount() == 0);
            assertEquals(1.0, registry.get("teamlens.observers.dropped").tag("reason", "send_failed").counter().count());
        }
    }

    @Nested
    @DisplayName("heartbeats")
    class Heartbeats {

        @Test
        @DisplayName("carry the observer count")
        void observerCount() throws Exception {
            var channel = connect("o1");
            connect("o2");

            hub.sendHeartbeats();

            JsonNode heartbeat = message(channel, 1);
            assertEquals("heartbeat", heartbeat.get("type").asText());
            assertEquals(2, heartbeat.at("/payload/observers").asInt());
        }

        @Test
        @DisplayName("remove observers whose transport closed")
        void pruneClosed() throws Exception {
            var gone = connect("gone");
            var live = connect("live");
            gone.disconnect();

            hub.sendHeartbeats();

            assertEquals(1, hub.observerCount());
            assertEquals(1, message(live, 1).at("/payload/observers").asInt());
            assertEquals(1, gone.sent().size());
        }
    }

    @Nested
    @DisplayName("requests")
    class Requests {

        @Test
        @DisplayName("switch_team answers with a snapshot scoped to that team")
        void switchTeam() throws Exception {
            var channel = connect("o1");

            hub.handleRequest("o1", "{\"type\":\"switch_team\",\"teamName\":\"beta\"}");

            JsonNode reply = message(channel, 1);
            assertEquals("snapshot", reply.get("type").asText());
            assertEquals("beta", reply.at("/payload/activeTeam").asText());
        }

        @Test
        @DisplayName("switch_team reads teamName from the request envelope's payload")
        void switchTeamEnvelope() throws Exception {
            var channel = connect("o1");

            hub.handleRequest("o1",
                    "{\"type\":\"switch_team\",\"payload\":{\"teamName\":\"beta\"},\"timestamp\":\"2026-01-05T10:00:00Z\"}");

            JsonNode reply = message(channel, 1);
            assertEquals("snapshot", reply.get("type").asText());
            assertEquals("beta", reply.at("/payload/activeTeam").asText());
        }

        @Test
        @DisplayName("the switched team sticks for later snapshots")
        void switchSticks() throws Exception {
            var channel = connect("o1");
            hub.handleRequest("o1", "{\"type\":\"switch_team\",\"teamName\":\"beta\"}");
            message(channel, 1);

            hub.handleRequest("o1", "{\"type\":\"switch_team\",\"teamName\":\"beta\"}");

            assertEquals("beta", message(channel, 2).at("/payload/activeTeam").asText());
        }

        @Test
        @DisplayName("switch_team to an unknown team is an error for the requester only")
        void unknownTeam() throws Exception {
            var channel = connect("o1");
            var other = connect("o2");

            hub.handleRequest("o1", "{\"type\":\"switch_team\",\"teamName\":\"gamma\"}");

            JsonNode reply = message(channel, 1);
            assertEquals("error", reply.get("type").asText());
            assertEquals("Unknown team: gamma", reply.at("/payload/message").asText());
            assertEquals(1, other.sent().size());
        }

        @Test
        @DisplayName("get_history returns the session index")
        void history() throws Exception {
            when(store.listSessions()).thenReturn(List.of(
                    new SessionSummary(3, "alpha", "Build it", 1000, 1100, null, 2, 5, 1)));
            var channel = connect("o1");

            hub.handleRequest("o1", "{\"type\":\"get_history\"}");

            JsonNode reply = message(channel, 1);
            assertEquals("history", reply.get("type").asText());
            assertEquals(3, reply.at("/payload/0/id").asLong());
            assertEquals(5, reply.at("/payload/0/messageCount").asInt());
        }

        @Test
        @DisplayName("get_session returns the session detail")
        void session() throws Exception {
            var summary = new SessionSummary(3, "alpha", "Build it", 1000, 1100, null, 0, 0, 0);
            when(store.findSession(3L)).thenReturn(Optional.of(
                    new SessionDetail(summary, alpha.config(), List.of(), List.of(), List.of())));
            var channel = connect("o1");

            hub.handleRequest("o1", "{\"type\":\"get_session\",\"sessionId\":3}");

            JsonNode reply = message(channel, 1);
            assertEquals("session_detail", reply.get("type").asText());
            assertEquals("alpha", reply.at("/payload/session/teamName").asText());
        }

        @Test
        @DisplayName("get_session reads sessionId from the request envelope's payload")
        void sessionEnvelope() throws Exception {
            var summary = new SessionSummary(1, "alpha", "Build it", 1000, 1100, null, 0, 0, 0);
            when(store.findSession(1L)).thenReturn(Optional.of(
                    new SessionDetail(summary, alpha.config(), List.of(), List.of(), List.of())));
            var channel = connect("o1");

            hub.handleRequest("o1", "{\"type\":\"get_session\",\"payload\":{\"sessionId\":1}}");
            hub.handleRequest("o1", "{\"type\":\"get_session\",\"payload\":{\"sessionId\":\"1\"},\"timestamp\":\"t\"}");

            assertEquals("session_detail", message(channel, 1).get("type").asText());
            assertEquals(1, message(channel, 2).at("/payload/session/id").asLong());
            verify(store, times(2)).findSession(1L);
        }

        @Test
        @DisplayName("the payload wins over top-level arguments")
        void payloadWins() throws Exception {
            var channel = connect("o1");

            hub.handleRequest("o1",
                    "{\"type\":\"switch_team\",\"teamName\":\"gamma\",\"payload\":{\"teamName\":\"beta\"}}");

            assertEquals("beta", message(channel, 1).at("/payload/activeTeam").asText());
        }

        @Test
        @DisplayName("a non-numeric sessionId in the payload is treated as missing")
        void sessionIdNotNumeric() throws Exception {
            var channel = connect("o1");

            hub.handleRequest("o1", "{\"type\":\"get_session\",\"payload\":{\"sessionId\":\"latest\"}}");

            assertEquals("get_session requires sessionId", message(channel, 1).at("/payload/message").asText());
            verifyNoInteractions(store);
        }

        @Test
        @DisplayName("get_session for an unknown id is an error")
        void sessionNotFound() throws Exception {
            when(store.findSession(99L)).thenReturn(Optional.empty());
            var channel = connect("o1");

            hub.handleRequest("o1", "{\"type\":\"get_session\",\"sessionId\":99}");

            assertEquals("Session not found: 99", message(channel, 1).at("/payload/message").asText());
        }

        @Test
        @DisplayName("get_session without an id is an error")
        void sessionWithoutId() throws Exception {
            var channel = connect("o1");

            hub.handleRequest("o1", "{\"type\":\"get_session\"}");

            assertEquals("error", message(channel, 1).get("type").asText());
            verifyNoInteractions(store);
        }

        @Test
        @DisplayName("store failures become an error reply")
        void storeUnavailable() throws Exception {
            when(store.listSessions()).thenThrow(new SessionStoreException("disk I/O error"));
            var channel = connect("o1");

            hub.handleRequest("o1", "{\"type\":\"get_history\"}");

            assertEquals("Session history is unavailable", message(channel, 1).at("/payload/message").asText());
            assertEquals(1, hub.observerCount());
        }

        @Test
        @DisplayName("malformed JSON is an error and the observer stays connected")
        void malformed() throws Exception {
            var channel = connect("o1");

            hub.handleRequest("o1", "{not json");

            JsonNode reply = message(channel, 1);
            assertEquals("error", reply.get("type").asText());
            assertTrue(reply.at("/payload/message").asText().startsWith("Malformed request"));
            assertEquals(1, hub.observerCount());
        }

        @Test
        @DisplayName("unknown or missing request types are errors")
        void unknownType() throws Exception {
            var channel = connect("o1");

            hub.handleRequest("o1", "{\"type\":\"dance\"}");
            hub.handleRequest("o1", "{\"teamName\":\"alpha\"}");

            assertEquals("Unknown request type: dance", message(channel, 1).at("/payload/message").asText());
            assertEquals("Request has no type", message(channel, 2).at("/payload/message").asText());
        }

        @Test
        @DisplayName("requests from unregistered observers are ignored")
        void unknownObserver() {
            assertDoesNotThrow(() -> hub.handleRequest("ghost", "{\"type\":\"get_history\"}"));
            verifyNoInteractions(store);
        }
    }
}
