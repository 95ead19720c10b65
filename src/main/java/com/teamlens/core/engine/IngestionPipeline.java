package com.teamlens.core.engine;

import com.teamlens.core.persistence.SessionRecorder;
import com.teamlens.core.state.StateAggregator;
import com.teamlens.core.watch.TeamFileWatcher;
import com.teamlens.dispatch.ws.BroadcastHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts and stops the watcher-to-observer pipeline.
 * <p>
 * Runs in phase 0, before the embedded web server starts, so a missing watched root
 * aborts startup before anything is served. Shutdown order is watcher, aggregator,
 * recorder, hub: no new changes arrive, queued merges finish, their writes are
 * persisted, and only then are observer connections closed.
 */
@Component
@ConditionalOnWebApplication
public class IngestionPipeline implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final TeamFileWatcher watcher;
    private final StateAggregator aggregator;
    private final SessionRecorder recorder;
    private final BroadcastHub hub;

    private volatile boolean running;

    public IngestionPipeline(TeamFileWatcher watcher, StateAggregator aggregator,
                             SessionRecorder recorder, BroadcastHub hub) {
        this.watcher = watcher;
        this.aggregator = aggregator;
        this.recorder = recorder;
        this.hub = hub;
    }

    @Override
    public void start() {
        log.info("Starting ingestion pipeline");
        watcher.start(aggregator::submit);
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping ingestion pipeline");
        watcher.stop();
        aggregator.shutdown(DRAIN_TIMEOUT);
        recorder.shutdown(DRAIN_TIMEOUT);
        hub.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
