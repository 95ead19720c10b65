package com.teamlens.dispatch.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * One connected observer with its own outbound queue.
 * <p>
 * {@link #enqueue(String)} never blocks: messages are queued and drained by at most one
 * task at a time on the shared sender executor, so a slow observer only delays itself.
 * An observer whose channel is closed, whose send fails, or whose queue grows beyond
 * {@code maxPending} is failed once and reported to {@code onFailure}.
 */
final class ObserverConnection {

    private static final Logger log = LoggerFactory.getLogger(ObserverConnection.class);

    private final ObserverChannel channel;
    private final Executor sender;
    private final int maxPending;
    private final BiConsumer<ObserverConnection, String> onFailure;

    private final Queue<String> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();

    private volatile String viewingTeam;

    ObserverConnection(ObserverChannel channel, Executor sender, int maxPending,
                       BiConsumer<ObserverConnection, String> onFailure) {
        this.channel = channel;
        this.sender = sender;
        this.maxPending = maxPending;
        this.onFailure = onFailure;
    }

    String id() {
        return channel.id();
    }

    boolean isOpen() {
        return !failed.get() && channel.isOpen();
    }

    String viewingTeam() {
        return viewingTeam;
    }

    void viewTeam(String teamName) {
        this.viewingTeam = teamName;
    }

    int pendingCount() {
        return pending.get();
    }

    /**
     * Queues a serialized message for delivery.
     *
     * @return {@code false} if the observer has failed or was failed by this call
     */
    boolean enqueue(String json) {
        if (failed.get()) {
            return false;
        }
        if (pending.incrementAndGet() > maxPending) {
            pending.decrementAndGet();
            fail("backlog");
            return false;
        }
        outbound.add(json);
        scheduleDrain();
        return true;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            sender.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            fail("shutdown");
        }
    }

    private void drain() {
        try {
            String next;
            while (!failed.get() && (next = outbound.poll()) != null) {
                pending.decrementAndGet();
                if (!channel.isOpen()) {
                    fail("closed");
                    return;
                }
                channel.send(next);
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Send to observer {} failed: {}", id(), e.getMessage());
            fail("send_failed");
            return;
        } finally {
            draining.set(false);
        }
        // A message may have been queued after the last poll but before draining was cleared.
        if (!outbound.isEmpty()) {
            scheduleDrain();
        }
    }

    /**
     * Marks the observer failed, discards queued messages and closes the channel. Idempotent.
     */
    void fail(String reason) {
        if (!failed.compareAndSet(false, true)) {
            return;
        }
        outbound.clear();
        pending.set(0);
        close();
        onFailure.accept(this, reason);
    }

    void close() {
        try {
            channel.close();
        } catch (RuntimeException e) {
            log.debug("Error closing observer {}: {}", id(), e.getMessage());
        }
    }
}
