package com.agentexec.engine.events;

import com.agentexec.core.model.ExecutionEvent;
import com.agentexec.core.model.ExecutionEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for engine notifications (state changes, checkpoints, agent admission).
 * <p>
 * Subscribers run on the publishing thread. A subscriber that throws is logged and skipped;
 * it never affects the publisher or other subscribers.
 */
public class ExecutionEventBus {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEventBus.class);

    private final Map<ExecutionEventType, CopyOnWriteArrayList<Consumer<ExecutionEvent>>> typeSubscribers =
        new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ExecutionEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to subscribers of its type and to global subscribers.
     */
    public void publish(ExecutionEvent event) {
        log.debug("Publishing event: {} for {}", event.type(), event.subjectId());

        List<Consumer<ExecutionEvent>> subs = typeSubscribers.get(event.type());
        if (subs != null) {
            for (Consumer<ExecutionEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<ExecutionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to one event type.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(ExecutionEventType type, Consumer<ExecutionEvent> consumer) {
        typeSubscribers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<ExecutionEvent>> subs = typeSubscribers.get(type);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every event.
     */
    public Subscription subscribeAll(Consumer<ExecutionEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount() {
        int count = globalSubscribers.size();
        for (List<Consumer<ExecutionEvent>> subs : typeSubscribers.values()) {
            count += subs.size();
        }
        return count;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ExecutionEvent> subscriber, ExecutionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.type(), e.getMessage(), e);
        }
    }
}
