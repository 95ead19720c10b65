package com.teamlens.core.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Coalesces bursts of raw notifications for the same path into one classified change.
 * <p>
 * Every notification restarts a fixed-delay timer for its path. Only the timer that fires
 * without being superseded classifies the path and forwards it to the sink, so a steady
 * stream of notifications faster than the delay yields exactly one change once it quiesces.
 * Timers fire on a single thread, so the sink sees changes one at a time.
 */
public class ChangeDebouncer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChangeDebouncer.class);

    private final PathClassifier classifier;
    private final long delayMillis;
    private final Consumer<FileChange> sink;

    private final Map<Path, PendingChange> pending = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private volatile boolean closed;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "change-debouncer");
        t.setDaemon(true);
        return t;
    });

    public ChangeDebouncer(PathClassifier classifier, long delayMillis, Consumer<FileChange> sink) {
        this.classifier = classifier;
        this.delayMillis = delayMillis;
        this.sink = sink;
    }

    /**
     * Records a raw notification for {@code path}, cancelling any timer already pending for it.
     */
    public void notifyChanged(Path path) {
        if (closed) {
            return;
        }
        pending.compute(path, (p, existing) -> {
            if (existing != null) {
                existing.future().cancel(false);
            }
            long generation = generations.incrementAndGet();
            try {
                ScheduledFuture<?> future = scheduler.schedule(
                        () -> fire(p, generation), delayMillis, TimeUnit.MILLISECONDS);
                return new PendingChange(generation, future);
            } catch (RejectedExecutionException e) {
                log.debug("Debouncer closed, dropping notification for {}", p);
                return null;
            }
        });
    }

    /**
     * Number of paths with a timer still pending.
     */
    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        closed = true;
        pending.values().forEach(p -> p.future().cancel(false));
        pending.clear();
        scheduler.shutdownNow();
    }

    private void fire(Path path, long generation) {
        var current = new AtomicBoolean(false);
        pending.computeIfPresent(path, (p, entry) -> {
            if (entry.generation() == generation) {
                current.set(true);
                return null;
            }
            return entry;
        });
        if (!current.get() || closed) {
            return;
        }

        FileChange change = classifier.classify(path);
        if (!change.isRelevant()) {
            log.trace("Ignoring change to unrecognised path {}", path);
            return;
        }
        try {
            sink.accept(change);
        } catch (Exception e) {
            log.warn("Change sink failed for {}: {}", path, e.getMessage(), e);
        }
    }

    private record PendingChange(long generation, ScheduledFuture<?> future) {}
}
