package com.teamlens.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for ingestion, persistence and broadcast.
 */
@Service
public class TeamlensMetrics {

    private final MeterRegistry registry;

    public TeamlensMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordChangeApplied(String kind) {
        Counter.builder("teamlens.changes.applied")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Records a read or parse failure. These are expected while the runtime is mid-write.
     *
     * @param kind   change kind that failed ("config", "inbox", "task")
     * @param reason "missing" when the file vanished, "malformed" otherwise
     */
    public void recordParseFailure(String kind, String reason) {
        Counter.builder("teamlens.changes.parse_failures")
                .description("Team files that could not be read or parsed")
                .tag("kind", kind)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPersistence(String kind, long ms) {
        Timer.builder("teamlens.persistence.duration")
                .tag("kind", kind)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPersistenceFailure(String kind) {
        Counter.builder("teamlens.persistence.failures")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordDroppedObserver(String reason) {
        Counter.builder("teamlens.observers.dropped")
                .description("Observers removed after a failed or backed-up transport")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void registerObserverGauge(Supplier<Number> connected) {
        Gauge.builder("teamlens.observers.connected", connected)
                .description("Currently connected observers")
                .register(registry);
    }
}
