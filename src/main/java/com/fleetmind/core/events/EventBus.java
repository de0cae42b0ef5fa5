package com.fleetmind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for worker and pipeline notifications.
 * <p>
 * Subscribers register either under a key (a pipeline id or a worker id) or globally.
 * An event reaches the subscribers of its pipeline id, of its worker id, and every
 * global subscriber. Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Keyed subscribers, keyed by pipeline id or worker id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<FleetEvent>>> keyedSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<FleetEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers.
     *
     * @param event the event to publish
     */
    public void publish(FleetEvent event) {
        log.debug("Publishing event: {} for pipeline {} worker {}",
                event.eventType(), event.pipelineId(), event.workerId());

        deliverTo(event.pipelineId(), event);
        if (!Objects.equals(event.workerId(), event.pipelineId())) {
            deliverTo(event.workerId(), event);
        }

        for (Consumer<FleetEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one pipeline or one worker.
     *
     * @param key      pipeline id or worker id
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String key, Consumer<FleetEvent> consumer) {
        keyedSubscribers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", key);
        return () -> {
            CopyOnWriteArrayList<Consumer<FleetEvent>> subs = keyedSubscribers.get(key);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    keyedSubscribers.remove(key, subs);
                }
            }
        };
    }

    /**
     * Subscribe to every event (global subscription).
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<FleetEvent> consumer) {
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

    private void deliverTo(String key, FleetEvent event) {
        if (key == null) {
            return;
        }
        List<Consumer<FleetEvent>> subs = keyedSubscribers.get(key);
        if (subs != null) {
            for (Consumer<FleetEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
    }

    private void deliverSafely(Consumer<FleetEvent> subscriber, FleetEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
