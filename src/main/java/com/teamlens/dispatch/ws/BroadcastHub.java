package com.teamlens.dispatch.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamlens.core.events.EventBus;
import com.teamlens.core.events.TeamChange;
import com.teamlens.core.metrics.TeamlensMetrics;
import com.teamlens.core.model.TeamsSnapshot;
import com.teamlens.core.persistence.SessionStore;
import com.teamlens.core.persistence.SessionStoreException;
import com.teamlens.core.state.StateAggregator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of connected observers and fan-out point for team changes.
 * <p>
 * A new observer immediately receives a full snapshot. Every {@link TeamChange} is
 * serialized once and queued to every observer as a {@code team_update}. Requests from
 * an observer (switch team, history index, one session) are answered to that observer
 * only. A heartbeat carrying the observer count goes out every few seconds, and observers
 * whose transport has closed are removed at that point or on their next failed send.
 */
@Service
public class BroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final StateAggregator aggregator;
    private final SessionStore store;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final BroadcastProperties properties;
    private final TeamlensMetrics metrics;

    private final Map<String, ObserverConnection> observers = new ConcurrentHashMap<>();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private final ExecutorService sender = Executors.newCachedThreadPool(new DaemonThreadFactory("observer-sender"));

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "observer-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private volatile EventBus.Subscription subscription;

    public BroadcastHub(StateAggregator aggregator, SessionStore store, EventBus eventBus,
                        ObjectMapper objectMapper, BroadcastProperties properties, TeamlensMetrics metrics) {
        this.aggregator = aggregator;
        this.store = store;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.metrics = metrics;
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribe(this::onChange);
        metrics.registerObserverGauge(observers::size);
        int interval = properties.getHeartbeatSeconds();
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, interval, interval, TimeUnit.SECONDS);
        log.info("Broadcast hub started (heartbeat={}s, maxPending={})", interval, properties.getMaxPendingMessages());
    }

    /**
     * Adds an observer and sends it the current full snapshot.
     */
    public void register(ObserverChannel channel) {
        if (stopped.get()) {
            channel.close();
            return;
        }
        var connection = new ObserverConnection(channel, sender, properties.getMaxPendingMessages(), this::dropped);
        observers.put(channel.id(), connection);
        log.info("Observer {} connected ({} total)", channel.id(), observers.size());
        sendSnapshot(connection, aggregator.snapshot());
    }

    /**
     * Removes an observer after its transport reported closure. Not an error.
     */
    public void unregister(String observerId) {
        if (observers.remove(observerId) != null) {
            log.info("Observer {} disconnected ({} remaining)", observerId, observers.size());
        }
    }

    public int observerCount() {
        return observers.size();
    }

    /**
     * Queues a {@code team_update} for every observer. Never blocks on any observer's transport.
     */
    public void onChange(TeamChange change) {
        if (observers.isEmpty()) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("teamName", change.teamName());
        payload.put("changeKind", change.kind().wireName());
        if (change.agentName() != null) {
            payload.put("agentName", change.agentName());
        }
        if (change.taskId() != null) {
            payload.put("taskId", change.taskId());
        }
        payload.put("data", change.payload());

        String json = serialize(ObserverMessage.of(ObserverMessageType.TEAM_UPDATE, payload));
        if (json == null) {
            return;
        }
        for (ObserverConnection connection : observers.values()) {
            connection.enqueue(json);
        }
        log.debug("Queued {} update for team {} to {} observers",
                change.kind().wireName(), change.teamName(), observers.size());
    }

    /**
     * Answers one request from an observer. Malformed or unknown requests get an
     * {@code error} reply; nothing is sent to other observers.
     */
    public void handleRequest(String observerId, String json) {
        ObserverConnection connection = observers.get(observerId);
        if (connection == null) {
            log.debug("Request from unknown observer {}", observerId);
            return;
        }
        ObserverRequest request;
        try {
            request = objectMapper.readValue(json, ObserverRequest.class);
        } catch (JsonProcessingException e) {
            sendError(connection, "Malformed request: " + e.getOriginalMessage());
            return;
        }
        if (request == null || request.type() == null) {
            sendError(connection, "Request has no type");
            return;
        }

        try {
            switch (request.type()) {
                case ObserverRequest.SWITCH_TEAM -> switchTeam(connection, request.requestedTeam());
                case ObserverRequest.GET_HISTORY ->
                        send(connection, ObserverMessage.of(ObserverMessageType.HISTORY, store.listSessions()));
                case ObserverRequest.GET_SESSION -> sendSession(connection, request.requestedSessionId());
                default -> sendError(connection, "Unknown request type: " + request.type());
            }
        } catch (SessionStoreException e) {
            log.warn("Could not answer {} for observer {}: {}", request.type(), observerId, e.getMessage());
            sendError(connection, "Session history is unavailable");
        }
    }

    private void switchTeam(ObserverConnection connection, String teamName) {
        if (teamName == null || teamName.isBlank()) {
            sendError(connection, "switch_team requires teamName");
            return;
        }
        TeamsSnapshot snapshot = aggregator.snapshot();
        if (!snapshot.teams().containsKey(teamName)) {
            sendError(connection, "Unknown team: " + teamName);
            return;
        }
        connection.viewTeam(teamName);
        log.debug("Observer {} now viewing team {}", connection.id(), teamName);
        sendSnapshot(connection, snapshot);
    }

    private void sendSession(ObserverConnection connection, Long sessionId) {
        if (sessionId == null) {
            sendError(connection, "get_session requires sessionId");
            return;
        }
        store.findSession(sessionId).ifPresentOrElse(
                detail -> send(connection, ObserverMessage.of(ObserverMessageType.SESSION_DETAIL, detail)),
                () -> sendError(connection, "Session not found: " + sessionId));
    }

    private void sendSnapshot(ObserverConnection connection, TeamsSnapshot snapshot) {
        String viewing = connection.viewingTeam();
        TeamsSnapshot scoped = viewing != null ? snapshot.withActiveTeam(viewing) : snapshot;
        send(connection, ObserverMessage.of(ObserverMessageType.SNAPSHOT, scoped));
    }

    private void sendError(ObserverConnection connection, String message) {
        send(connection, ObserverMessage.of(ObserverMessageType.ERROR, Map.of("message", message)));
    }

    private void send(ObserverConnection connection, ObserverMessage message) {
        String json = serialize(message);
        if (json != null) {
            connection.enqueue(json);
        }
    }

    /**
     * Removes observers whose transport has closed, then sends every remaining
     * observer the current observer count.
     */
    void sendHeartbeats() {
        for (ObserverConnection connection : observers.values()) {
            if (!connection.isOpen()) {
                connection.fail("closed");
            }
        }
        if (observers.isEmpty()) {
            return;
        }
        String json = serialize(ObserverMessage.of(ObserverMessageType.HEARTBEAT,
                Map.of("observers", observers.size())));
        if (json == null) {
            return;
        }
        for (ObserverConnection connection : observers.values()) {
            connection.enqueue(json);
        }
    }

    private void dropped(ObserverConnection connection, String reason) {
        if (observers.remove(connection.id(), connection)) {
            metrics.recordDroppedObserver(reason);
            log.info("Dropped observer {} ({}), {} remaining", connection.id(), reason, observers.size());
        }
    }

    private String serialize(ObserverMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} message", message.type().wireName(), e);
            return null;
        }
    }

    /**
     * Stops heartbeats and change delivery, then closes every observer connection.
     */
    @PreDestroy
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        EventBus.Subscription current = subscription;
        if (current != null) {
            current.unsubscribe();
        }
        heartbeatScheduler.shutdownNow();
        for (ObserverConnection connection : observers.values()) {
            connection.close();
        }
        observers.clear();
        sender.shutdown();
        try {
            if (!sender.awaitTermination(2, TimeUnit.SECONDS)) {
                sender.shutdownNow();
            }
        } catch (InterruptedException e) {
            sender.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Broadcast hub stopped");
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        DaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
