package com.braid.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static BraidEvent event(String type, String sessionId) {
        return BraidEvent.of(type, sessionId, "T1", Map.of());
    }

    @Nested
    @DisplayName("BraidEvent")
    class BraidEventTests {

        @Test
        @DisplayName("of() stamps the current time and keeps the payload")
        void factory() {
            var event = BraidEvent.of(BraidEvent.AGENT_SKIPPED, "S1", null, Map.of("reason", "limit"));

            assertEquals("agent.skipped", event.eventType());
            assertEquals("S1", event.sessionId());
            assertNull(event.taskId());
            assertEquals("limit", event.payload().get("reason"));
            assertNotNull(event.timestamp());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to session subscriber")
        void deliversToSessionSubscriber() {
            List<BraidEvent> received = new ArrayList<>();
            eventBus.subscribe("S1", received::add);

            var event = event(BraidEvent.AGENT_SPAWNED, "S1");
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver events of other sessions")
        void otherSession() {
            List<BraidEvent> received = new ArrayList<>();
            eventBus.subscribe("S2", received::add);

            eventBus.publish(event(BraidEvent.AGENT_SPAWNED, "S1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscribers receive every session's events")
        void globalSubscriber() {
            List<BraidEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(BraidEvent.AGENT_SPAWNED, "S1"));
            eventBus.publish(event(BraidEvent.AGENT_FAILED, "S2"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribed consumers stop receiving events")
        void unsubscribe() {
            List<BraidEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("S1", received::add);
            EventBus.Subscription global = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            global.unsubscribe();
            eventBus.publish(event(BraidEvent.AGENT_SPAWNED, "S1"));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("session history")
    class SessionHistoryTests {

        @Test
        @DisplayName("keeps each session's events in publish order")
        void perSessionHistory() {
            var spawned = event(BraidEvent.AGENT_SPAWNED, "S1");
            var failed = event(BraidEvent.AGENT_FAILED, "S1");
            eventBus.publish(spawned);
            eventBus.publish(event(BraidEvent.AGENT_SKIPPED, "S2"));
            eventBus.publish(failed);

            assertEquals(List.of(spawned, failed), eventBus.recentEvents("S1"));
            assertEquals(1, eventBus.recentEvents("S2").size());
            assertTrue(eventBus.recentEvents("S3").isEmpty());
        }

        @Test
        @DisplayName("keeps only the most recent events of a busy session")
        void boundedHistory() {
            for (int i = 0; i < EventBus.RECENT_EVENTS_PER_SESSION + 5; i++) {
                eventBus.publish(BraidEvent.of(BraidEvent.AGENT_SKIPPED, "S1", "T" + i, Map.of()));
            }

            List<BraidEvent> recent = eventBus.recentEvents("S1");
            assertEquals(EventBus.RECENT_EVENTS_PER_SESSION, recent.size());
            assertEquals("T5", recent.get(0).taskId());
            assertEquals("T" + (EventBus.RECENT_EVENTS_PER_SESSION + 4), recent.get(recent.size() - 1).taskId());
        }

        @Test
        @DisplayName("events without a session reach global subscribers only")
        void sessionlessEvent() {
            List<BraidEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(BraidEvent.of(BraidEvent.AGENT_SKIPPED, null, "T1", Map.of()));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("forgetting a session drops its history and subscribers")
        void forgetSession() {
            List<BraidEvent> received = new ArrayList<>();
            eventBus.subscribe("S1", received::add);
            eventBus.publish(event(BraidEvent.AGENT_SPAWNED, "S1"));

            eventBus.forgetSession("S1");
            eventBus.publish(event(BraidEvent.AGENT_FAILED, "S1"));

            assertEquals(1, received.size());
            assertEquals(1, eventBus.recentEvents("S1").size());
            assertFalse(eventBus.hasSessionSubscribers("S1"));
        }

        @Test
        @DisplayName("the last unsubscribe of a session removes its subscriber list")
        void lastUnsubscribePrunes() {
            EventBus.Subscription first = eventBus.subscribe("S1", e -> { });
            EventBus.Subscription second = eventBus.subscribe("S1", e -> { });

            first.unsubscribe();
            assertTrue(eventBus.hasSessionSubscribers("S1"));
            second.unsubscribe();

            assertFalse(eventBus.hasSessionSubscribers("S1"));
        }
    }

    @Nested
    @DisplayName("error isolation")
    class ErrorIsolationTests {

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to the others")
        void throwingSubscriber() {
            List<BraidEvent> received = new ArrayList<>();
            eventBus.subscribe("S1", e -> {
                throw new IllegalStateException("subscriber failure");
            });
            eventBus.subscribe("S1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(BraidEvent.WORKTREE_MERGED, "S1")));
            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("thread safety")
    class ThreadSafetyTests {

        @Test
        @DisplayName("concurrent publishers deliver every event")
        void concurrentPublish() throws Exception {
            List<BraidEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("S1", received::add);

            int threads = 10;
            var latch = new CountDownLatch(threads);
            for (int i = 0; i < threads; i++) {
                new Thread(() -> {
                    eventBus.publish(event(BraidEvent.AGENT_SPAWNED, "S1"));
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals(threads, received.size());
        }
    }
}
