package com.teamlens.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus carrying {@link TeamChange}s from the aggregator to its consumers.
 * <p>
 * Delivery is synchronous on the publishing thread, so subscribers must hand work off
 * rather than block. A failing subscriber never prevents delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<TeamChange>> subscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish a change to every subscriber, in subscription order.
     *
     * @param change the change to publish
     */
    public void publish(TeamChange change) {
        log.debug("Publishing {} change for team {}", change.kind().wireName(), change.teamName());
        for (Consumer<TeamChange> subscriber : subscribers) {
            deliverSafely(subscriber, change);
        }
    }

    /**
     * Subscribe to every change.
     *
     * @param consumer callback invoked for each change
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(Consumer<TeamChange> consumer) {
        subscribers.add(consumer);
        log.debug("Subscribed to team changes ({} subscribers)", subscribers.size());
        return () -> subscribers.remove(consumer);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TeamChange> subscriber, TeamChange change) {
        try {
            subscriber.accept(change);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {} change for {}: {}",
                    change.kind().wireName(), change.teamName(), e.getMessage(), e);
        }
    }
}
