package com.rekindle.rex.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for orchestration events.
 * <p>
 * Supports per-mission subscriptions, per-event-type subscriptions and global subscriptions
 * that receive all events. Publishers have no knowledge of subscribers; a subscriber that
 * throws never affects the publisher or other subscribers, and its failed event is kept in a
 * bounded dead-letter list for inspection.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int DEAD_LETTER_CAPACITY = 1000;

    /** Per-mission subscribers keyed by missionId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RexEvent>>> missionSubscribers =
            new ConcurrentHashMap<>();

    /** Per-type subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RexEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<RexEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Deque<DeadLetter> deadLetters = new ArrayDeque<>();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failedDeliveries = new AtomicLong();

    /**
     * Publish an event to all matching subscribers (mission-specific, type-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(RexEvent event) {
        log.debug("Publishing event: {} for mission {}", event.eventType(), event.missionId());
        published.incrementAndGet();

        if (event.missionId() != null) {
            deliverAll(missionSubscribers.get(event.missionId()), event);
        }
        deliverAll(typeSubscribers.get(event.eventType()), event);
        deliverAll(globalSubscribers, event);
    }

    /**
     * Subscribe to events for a specific mission.
     *
     * @param missionId the mission to subscribe to
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String missionId, Consumer<RexEvent> consumer) {
        return register(missionSubscribers, missionId, consumer);
    }

    /**
     * Subscribe to every event of one type, whatever mission it concerns.
     *
     * @param eventType the event type, e.g. {@link RexEventTypes#LEASE_RELEASED}
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeType(String eventType, Consumer<RexEvent> consumer) {
        return register(typeSubscribers, eventType, consumer);
    }

    /**
     * Subscribe to all events (global subscription).
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<RexEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    public List<DeadLetter> deadLetters() {
        synchronized (deadLetters) {
            return List.copyOf(deadLetters);
        }
    }

    public void clearDeadLetters() {
        synchronized (deadLetters) {
            deadLetters.clear();
        }
    }

    public long publishedCount() {
        return published.get();
    }

    public long failedDeliveryCount() {
        return failedDeliveries.get();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RexEvent>>> registry,
                                  String key, Consumer<RexEvent> consumer) {
        registry.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", key);
        return () -> {
            CopyOnWriteArrayList<Consumer<RexEvent>> subs = registry.get(key);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    private void deliverAll(List<Consumer<RexEvent>> subscribers, RexEvent event) {
        if (subscribers == null) {
            return;
        }
        for (Consumer<RexEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    private void deliverSafely(Consumer<RexEvent> subscriber, RexEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            failedDeliveries.incrementAndGet();
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
            synchronized (deadLetters) {
                if (deadLetters.size() >= DEAD_LETTER_CAPACITY) {
                    deadLetters.removeFirst();
                }
                deadLetters.addLast(new DeadLetter(event, String.valueOf(e.getMessage()), Instant.now()));
            }
        }
    }
}
