package com.keystone.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for orchestration events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * A subscriber that throws does not affect delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OrchestrationEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<OrchestrationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(OrchestrationEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<OrchestrationEvent>> subs = runSubscribers.get(event.runId());
        if (subs != null) {
            for (Consumer<OrchestrationEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<OrchestrationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<OrchestrationEvent> consumer) {
        runSubscribers.compute(runId, (id, subs) -> {
            var list = subs != null ? subs : new CopyOnWriteArrayList<Consumer<OrchestrationEvent>>();
            list.add(consumer);
            return list;
        });
        log.debug("Subscribed to run {}", runId);
        // a run's list goes away with its last subscriber
        return () -> runSubscribers.computeIfPresent(runId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OrchestrationEvent> subscriber, OrchestrationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
