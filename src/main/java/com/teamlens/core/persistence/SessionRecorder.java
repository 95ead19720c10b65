package com.teamlens.core.persistence;

import com.teamlens.core.events.EventBus;
import com.teamlens.core.events.TeamChange;
import com.teamlens.core.logging.MdcContext;
import com.teamlens.core.metrics.TeamlensMetrics;
import com.teamlens.core.model.InboxMessage;
import com.teamlens.core.model.Team;
import com.teamlens.core.model.TeamConfig;
import com.teamlens.core.model.TeamTask;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Mirrors every {@link TeamChange} into the {@link SessionStore}.
 * <p>
 * Writes run on a dedicated thread so the aggregator never waits on the database.
 * Changes for a team whose config has not been read yet are skipped; they are
 * recorded later, together with the rest of the team, once the config arrives.
 */
@Service
public class SessionRecorder {

    private static final Logger log = LoggerFactory.getLogger(SessionRecorder.class);

    private final EventBus eventBus;
    private final SessionStore store;
    private final TeamlensMetrics metrics;

    /** Team name to the session of its current config. */
    private final Map<String, SessionRef> sessions = new ConcurrentHashMap<>();

    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "session-recorder");
        t.setDaemon(true);
        return t;
    });

    private volatile EventBus.Subscription subscription;

    public SessionRecorder(EventBus eventBus, SessionStore store, TeamlensMetrics metrics) {
        this.eventBus = eventBus;
        this.store = store;
        this.metrics = metrics;
    }

    @PostConstruct
    public void subscribe() {
        subscription = eventBus.subscribe(this::enqueue);
        log.info("Session recorder subscribed to team changes");
    }

    private void enqueue(TeamChange change) {
        try {
            writer.execute(() -> record(change));
        } catch (RejectedExecutionException e) {
            log.debug("Recorder stopped, not persisting {} change for {}", change.kind().wireName(), change.teamName());
        }
    }

    /**
     * Persists one change. Failures are logged and counted; they never stop later writes.
     */
    void record(TeamChange change) {
        Team team = change.team();
        TeamConfig config = team.config();
        String kind = change.kind().wireName();
        if (config == null || config.createdAt() == null) {
            log.debug("No config yet for team {}, deferring {} change", team.name(), kind);
            return;
        }

        MdcContext.setTeam(team.name());
        long start = System.currentTimeMillis();
        try {
            SessionRef previous = sessions.get(team.name());
            SessionRef session = sessionFor(team.name(), config);
            switch (change.kind()) {
                case TEAM_CONFIG -> {
                    if (previous != null && previous.id() != session.id()) {
                        recordNewRun(session, team, previous);
                    } else {
                        recordTeam(session, team);
                    }
                }
                case INBOX -> {
                    MdcContext.setAgent(team.name(), change.agentName());
                    List<InboxMessage> inbox = team.inboxes().getOrDefault(change.agentName(), List.of());
                    int inserted = store.recordInbox(session.id(), change.agentName(), inbox);
                    log.debug("Recorded {} new message(s) for {} in session {}", inserted, change.agentName(), session.id());
                }
                case TASK -> {
                    MdcContext.setTask(team.name(), change.taskId());
                    TeamTask task = team.tasks().get(change.taskId());
                    if (task != null) {
                        store.recordTask(session.id(), task);
                    }
                }
                case IGNORED -> {
                    return;
                }
            }
            metrics.recordPersistence(kind, System.currentTimeMillis() - start);
        } catch (SessionStoreException e) {
            metrics.recordPersistenceFailure(kind);
            log.warn("Failed to persist {} change for team {}: {}", kind, team.name(), e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
    }

    private SessionRef sessionFor(String teamName, TeamConfig config) {
        SessionRef cached = sessions.get(teamName);
        if (cached != null && cached.createdAt() == config.createdAt()) {
            return cached;
        }
        SessionRef session = store.ensureSession(teamName, config);
        sessions.put(teamName, session);
        return session;
    }

    /**
     * Records the roster plus every inbox and task already known for the team, so files
     * read before the config are not lost.
     */
    private void recordTeam(SessionRef session, Team team) {
        int members = store.recordMembers(session.id(), team.config().members());
        int messages = 0;
        for (var inbox : team.inboxes().entrySet()) {
            messages += store.recordInbox(session.id(), inbox.getKey(), inbox.getValue());
        }
        for (TeamTask task : team.tasks().values()) {
            store.recordTask(session.id(), task);
        }
        log.info("Session {} of team {}: {} new member(s), {} new message(s), {} task(s) synced",
                session.id(), team.name(), members, messages, team.tasks().size());
    }

    /**
     * Records only the roster. Inboxes and tasks still in memory may belong to the run
     * recorded in {@code previous}; the new run's own files arrive as separate changes.
     */
    private void recordNewRun(SessionRef session, Team team, SessionRef previous) {
        int members = store.recordMembers(session.id(), team.config().members());
        log.info("Session {} of team {} replaces session {}: {} new member(s)",
                session.id(), team.name(), previous.id(), members);
    }

    /**
     * Stops receiving changes and waits for queued writes to finish.
     */
    public void shutdown(Duration timeout) {
        EventBus.Subscription current = subscription;
        if (current != null) {
            current.unsubscribe();
        }
        writer.shutdown();
        try {
            if (!writer.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Session recorder did not drain within {}", timeout);
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Session recorder stopped");
    }
}
