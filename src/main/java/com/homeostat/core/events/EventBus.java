package com.homeostat.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for task and mode telemetry.
 * <p>
 * Supports per-trace subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-trace subscribers keyed by traceId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<HomeostatEvent>>> traceSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<HomeostatEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to its trace subscribers (if any) and to all global subscribers.
     *
     * @param event the event to publish
     */
    public void publish(HomeostatEvent event) {
        log.debug("Publishing event: {} for trace {}", event.eventType(), event.traceId());

        if (event.traceId() != null) {
            List<Consumer<HomeostatEvent>> traceSubs = traceSubscribers.get(event.traceId());
            if (traceSubs != null) {
                for (Consumer<HomeostatEvent> subscriber : traceSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<HomeostatEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific trace.
     *
     * @param traceId  the trace to follow
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String traceId, Consumer<HomeostatEvent> consumer) {
        traceSubscribers.computeIfAbsent(traceId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to trace {}", traceId);
        return () -> traceSubscribers.computeIfPresent(traceId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<HomeostatEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<HomeostatEvent> subscriber, HomeostatEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
