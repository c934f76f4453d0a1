package com.helmsman.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProcessingEventBus}.
 */
class ProcessingEventBusTest {

    private ProcessingEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new ProcessingEventBus();
    }

    private static ProcessingEvent event(String type, String documentId) {
        return new ProcessingEvent(type, documentId, null, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers events of the subscribed type only")
        void deliversMatchingType() {
            List<ProcessingEvent> received = new ArrayList<>();
            eventBus.subscribe("document.processed", received::add);

            eventBus.publish(event("document.processed", "doc-1"));
            eventBus.publish(event("document.rejected", null));

            assertEquals(1, received.size());
            assertEquals("doc-1", received.get(0).documentId());
        }

        @Test
        @DisplayName("global subscribers receive every event in order")
        void globalSubscriber() {
            List<ProcessingEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("document.processed", "doc-1"));
            eventBus.publish(event("document.rejected", null));

            assertEquals(List.of("document.processed", "document.rejected"),
                    received.stream().map(ProcessingEvent::eventType).toList());
        }

        @Test
        @DisplayName("type and global subscribers both receive the event")
        void typeAndGlobal() {
            List<ProcessingEvent> typed = new ArrayList<>();
            List<ProcessingEvent> global = new ArrayList<>();
            eventBus.subscribe("document.processed", typed::add);
            eventBus.subscribeAll(global::add);

            eventBus.publish(event("document.processed", "doc-1"));

            assertEquals(1, typed.size());
            assertEquals(1, global.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery")
        void unsubscribe() {
            List<ProcessingEvent> received = new ArrayList<>();
            ProcessingEventBus.Subscription subscription = eventBus.subscribe("document.processed", received::add);

            eventBus.publish(event("document.processed", "doc-1"));
            subscription.unsubscribe();
            eventBus.publish(event("document.processed", "doc-2"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing a global subscriber stops delivery")
        void unsubscribeGlobal() {
            List<ProcessingEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            eventBus.publish(event("document.processed", "doc-1"));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("publishing with no subscribers does not throw")
        void noSubscribers() {
            assertDoesNotThrow(() -> eventBus.publish(event("document.processed", "doc-1")));
        }

        @Test
        @DisplayName("a failing subscriber does not block the others")
        void failingSubscriber() {
            List<ProcessingEvent> received = new ArrayList<>();
            eventBus.subscribe("document.processed", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("document.processed", received::add);

            eventBus.publish(event("document.processed", "doc-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("an event typed as the wildcard reaches global subscribers once")
        void wildcardTypedEvent() {
            List<ProcessingEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(ProcessingEventBus.ALL_EVENTS, "doc-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes safely")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<ProcessingEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);

            int threadCount = 8;
            int eventsPerThread = 50;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                final int threadId = t;
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event("document.processed", "doc-" + threadId + "-" + i));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }
    }
}
