package com.helmsman.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe channel for {@link ProcessingEvent}s.
 * <p>
 * Collaborators that store or forward results subscribe here, either to one
 * event type or to {@link #ALL_EVENTS}. A failing subscriber is logged and
 * skipped; delivery to the others continues. Safe for concurrent use.
 */
@Service
public class ProcessingEventBus {

    private static final Logger log = LoggerFactory.getLogger(ProcessingEventBus.class);

    /** Registration key of subscribers that receive every event. */
    public static final String ALL_EVENTS = "*";

    private final Map<String, List<Consumer<ProcessingEvent>>> subscribers = new ConcurrentHashMap<>();

    public void publish(ProcessingEvent event) {
        Objects.requireNonNull(event, "event");
        int delivered = deliver(subscribers.get(event.eventType()), event);
        if (!ALL_EVENTS.equals(event.eventType())) {
            delivered += deliver(subscribers.get(ALL_EVENTS), event);
        }
        log.debug("Event {} for document {} reached {} subscriber(s)",
                event.eventType(), event.documentId(), delivered);
    }

    /**
     * @param eventType event type to receive, or {@link #ALL_EVENTS}
     * @return handle that removes this registration
     */
    public Subscription subscribe(String eventType, Consumer<ProcessingEvent> consumer) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(consumer, "consumer");
        List<Consumer<ProcessingEvent>> registrations =
                subscribers.computeIfAbsent(eventType, type -> new CopyOnWriteArrayList<>());
        registrations.add(consumer);
        return () -> registrations.remove(consumer);
    }

    public Subscription subscribeAll(Consumer<ProcessingEvent> consumer) {
        return subscribe(ALL_EVENTS, consumer);
    }

    private static int deliver(List<Consumer<ProcessingEvent>> targets, ProcessingEvent event) {
        if (targets == null) {
            return 0;
        }
        int delivered = 0;
        for (Consumer<ProcessingEvent> subscriber : targets) {
            try {
                subscriber.accept(event);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on {} for document {}", event.eventType(), event.documentId(), e);
            }
        }
        return delivered;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
