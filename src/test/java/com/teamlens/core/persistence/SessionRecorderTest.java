package com.teamlens.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamlens.core.events.EventBus;
import com.teamlens.core.events.TeamChange;
import com.teamlens.core.metrics.TeamlensMetrics;
import com.teamlens.core.model.InboxMessage;
import com.teamlens.core.model.Member;
import com.teamlens.core.model.MessageType;
import com.teamlens.core.model.TaskStatus;
import com.teamlens.core.model.Team;
import com.teamlens.core.model.TeamConfig;
import com.teamlens.core.model.TeamTask;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link SessionRecorder}.
 */
class SessionRecorderTest {

    private static TeamConfig config(long createdAt) {
        return new TeamConfig("alpha", "Build the thing", createdAt, "lead@alpha", List.of(
                new Member("lead@alpha", "lead", "team-lead", "model-a", "blue", createdAt),
                new Member("worker@alpha", "worker", "general", "model-a", "green", createdAt)));
    }

    private static InboxMessage message(String text, String timestamp) {
        return new InboxMessage("lead", text, timestamp, "blue", false, MessageType.PLAIN_TEXT, null);
    }

    private static TeamTask task(String id, TaskStatus status) {
        return new TeamTask(id, "Task " + id, null, null, status, "worker", List.of(), List.of(), false);
    }

    @Nested
    @DisplayName("with a real store")
    class RealStore {

        @TempDir
        Path tempDir;

        private SessionStore store;
        private SimpleMeterRegistry registry;
        private SessionRecorder recorder;

        @BeforeEach
        void setUp() {
            store = new SessionStore(StorageConfig.createDataSource(tempDir.resolve("sessions.db"), 5000), new ObjectMapper());
            store.createTables();
            registry = new SimpleMeterRegistry();
            recorder = new SessionRecorder(new EventBus(), store, new TeamlensMetrics(registry));
        }

        @AfterEach
        void tearDown() {
            recorder.shutdown(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("changes before the config are deferred, then synced with the config")
        void deferredUntilConfig() {
            Team team = Team.empty("alpha")
                    .withInbox("worker", List.of(message("hi", "t1")))
                    .withTask("1", task("1", TaskStatus.PENDING));

            recorder.record(TeamChange.inbox(team, "worker"));
            recorder.record(TeamChange.task(team, "1"));
            assertTrue(store.listSessions().isEmpty());

            recorder.record(TeamChange.config(team.withConfig(config(1000))));

            SessionSummary summary = store.listSessions().get(0);
            assertEquals(2, summary.memberCount());
            assertEquals(1, summary.messageCount());
            assertEquals(1, summary.taskCount());
        }

        @Test
        @DisplayName("inbox changes add only new messages")
        void inboxChanges() {
            Team team = Team.empty("alpha").withConfig(config(1000));
            recorder.record(TeamChange.config(team));

            team = team.withInbox("worker", List.of(message("one", "t1")));
            recorder.record(TeamChange.inbox(team, "worker"));
            team = team.withInbox("worker", List.of(message("one", "t1"), message("two", "t2")));
            recorder.record(TeamChange.inbox(team, "worker"));
            recorder.record(TeamChange.inbox(team, "worker"));

            assertEquals(2, store.listSessions().get(0).messageCount());
        }

        @Test
        @DisplayName("task changes replace the stored task")
        void taskChanges() {
            Team team = Team.empty("alpha").withConfig(config(1000)).withTask("1", task("1", TaskStatus.PENDING));
            recorder.record(TeamChange.config(team));

            team = team.withTask("1", task("1", TaskStatus.IN_PROGRESS));
            recorder.record(TeamChange.task(team, "1"));

            long id = store.listSessions().get(0).id();
            var tasks = store.findSession(id).orElseThrow().tasks();
            assertEquals(1, tasks.size());
            assertEquals(TaskStatus.IN_PROGRESS, tasks.get(0).status());
        }

        @Test
        @DisplayName("a new config creation time opens a new session")
        void newRun() {
            Team first = Team.empty("alpha").withConfig(config(1000));
            recorder.record(TeamChange.config(first));
            recorder.record(TeamChange.config(first.withConfig(config(2000))));

            var sessions = store.listSessions();
            assertEquals(2, sessions.size());
            assertEquals(2000L, sessions.get(0).createdAt());
            assertNotNull(sessions.get(1).endedAt());
        }

        @Test
        @DisplayName("a new run's session does not inherit the previous run's messages or tasks")
        void newRunStartsEmpty() {
            Team first = Team.empty("alpha").withConfig(config(1000))
                    .withInbox("worker", List.of(message("hi", "t1")))
                    .withTask("1", task("1", TaskStatus.COMPLETED));
            recorder.record(TeamChange.config(first));
            recorder.record(TeamChange.config(first.withConfig(config(2000))));

            var sessions = store.listSessions();
            assertEquals(2, sessions.size());
            SessionSummary current = sessions.get(0);
            assertEquals(2000L, current.createdAt());
            assertEquals(2, current.memberCount());
            assertEquals(0, current.messageCount());
            assertEquals(0, current.taskCount());
            assertEquals(1, sessions.get(1).messageCount());
            assertEquals(1, sessions.get(1).taskCount());
        }

        @Test
        @DisplayName("published changes are persisted off the publishing thread")
        void subscribed() {
            EventBus bus = new EventBus();
            var subscribed = new SessionRecorder(bus, store, new TeamlensMetrics(registry));
            subscribed.subscribe();
            try {
                bus.publish(TeamChange.config(Team.empty("alpha").withConfig(config(1000))));

                await().atMost(Duration.ofSeconds(5))
                        .until(() -> store.listSessions().size() == 1);
            } finally {
                subscribed.shutdown(Duration.ofSeconds(1));
            }
            assertEquals(0, bus.subscriberCount());
        }

        @Test
        @DisplayName("successful writes are timed")
        void timed() {
            recorder.record(TeamChange.config(Team.empty("alpha").withConfig(config(1000))));

            assertEquals(1, registry.get("teamlens.persistence.duration").tag("kind", "config").timer().count());
        }
    }

    @Nested
    @DisplayName("with a failing store")
    class FailingStore {

        @Test
        @DisplayName("a store failure is counted and later changes are still attempted")
        void failureIsolated() {
            SessionStore store = mock(SessionStore.class);
            when(store.ensureSession(anyString(), any()))
                    .thenThrow(new SessionStoreException("database is locked"))
                    .thenReturn(new SessionRef(7, "alpha", 1000, true));
            var registry = new SimpleMeterRegistry();
            var recorder = new SessionRecorder(new EventBus(), store, new TeamlensMetrics(registry));
            Team team = Team.empty("alpha").withConfig(config(1000));

            recorder.record(TeamChange.config(team));
            recorder.record(TeamChange.config(team));

            assertEquals(1.0, registry.get("teamlens.persistence.failures").tag("kind", "config").counter().count());
            verify(store, times(2)).ensureSession(eq("alpha"), any());
            verify(store).recordMembers(eq(7L), anyList());
            recorder.shutdown(Duration.ofSeconds(1));
        }
    }
}
