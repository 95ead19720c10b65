package com.teamlens.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TeamlensMetricsTest {

    private SimpleMeterRegistry registry;
    private TeamlensMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TeamlensMetrics(registry);
    }

    @Test
    @DisplayName("recordChangeApplied counts by kind")
    void changeApplied() {
        metrics.recordChangeApplied("task");
        metrics.recordChangeApplied("task");
        metrics.recordChangeApplied("config");

        assertEquals(2.0, registry.find("teamlens.changes.applied").tag("kind", "task").counter().count());
        assertEquals(1.0, registry.find("teamlens.changes.applied").tag("kind", "config").counter().count());
    }

    @Test
    @DisplayName("recordParseFailure tags kind and reason")
    void parseFailure() {
        metrics.recordParseFailure("inbox", "malformed");

        var counter = registry.find("teamlens.changes.parse_failures")
                .tag("kind", "inbox").tag("reason", "malformed").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordPersistence creates a timer per kind")
    void persistence() {
        metrics.recordPersistence("config", 12);

        var timer = registry.find("teamlens.persistence.duration").tag("kind", "config").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordPersistenceFailure and recordDroppedObserver increment counters")
    void failures() {
        metrics.recordPersistenceFailure("task");
        metrics.recordDroppedObserver("backlog");

        assertEquals(1.0, registry.find("teamlens.persistence.failures").tag("kind", "task").counter().count());
        assertEquals(1.0, registry.find("teamlens.observers.dropped").tag("reason", "backlog").counter().count());
    }

    @Test
    @DisplayName("observer gauge follows the supplier")
    void observerGauge() {
        var connected = new AtomicInteger(2);
        metrics.registerObserverGauge(connected::get);

        assertEquals(2.0, registry.find("teamlens.observers.connected").gauge().value());
        connected.set(5);
        assertEquals(5.0, registry.find("teamlens.observers.connected").gauge().value());
    }
}
