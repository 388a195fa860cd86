package com.fiscalpilot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out for action lifecycle events.
 * <p>
 * Listeners register against an event-type prefix: {@code "action.rollback"} follows
 * {@code action.rolled_back} and {@code action.rollback_failed}, and the empty prefix follows
 * everything. Listeners are called on the publishing thread in registration order. A listener
 * that throws is logged and skipped; the publisher never sees the exception.
 */
public class PipelineEventBus {

    private static final Logger log = LoggerFactory.getLogger(PipelineEventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        int delivered = 0;
        for (Listener listener : listeners) {
            if (listener.accepts(event)) {
                listener.deliver(event);
                delivered++;
            }
        }
        log.debug("Event {} for action {} reached {} listener(s)", event.eventType(), event.actionId(), delivered);
    }

    /**
     * Follows every event whose type starts with {@code eventTypePrefix}.
     *
     * @return handle that removes the listener again
     */
    public Subscription subscribe(String eventTypePrefix, Consumer<PipelineEvent> consumer) {
        if (eventTypePrefix == null) {
            throw new IllegalArgumentException("eventTypePrefix must not be null");
        }
        Listener listener = new Listener(eventTypePrefix, consumer);
        listeners.add(listener);
        log.debug("Listener registered for '{}*'", eventTypePrefix);
        return () -> listeners.remove(listener);
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        return subscribe("", consumer);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    // Identity equality so that registering the same consumer twice yields two removable entries.
    private static final class Listener {

        private final String prefix;
        private final Consumer<PipelineEvent> consumer;

        Listener(String prefix, Consumer<PipelineEvent> consumer) {
            this.prefix = prefix;
            this.consumer = consumer;
        }

        boolean accepts(PipelineEvent event) {
            return event.eventType() != null && event.eventType().startsWith(prefix);
        }

        void deliver(PipelineEvent event) {
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener for '{}*' failed on {} ({}): {}",
                        prefix, event.eventType(), event.actionId(), e.getMessage(), e);
            }
        }
    }
}
