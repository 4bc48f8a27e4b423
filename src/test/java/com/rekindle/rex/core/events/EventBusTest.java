package com.rekindle.rex.core.events;

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
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static RexEvent event(String type, String missionId) {
        return new RexEvent(type, missionId, Map.of(), Instant.parse("2026-03-02T09:00:00Z"));
    }

    // -- Subscribe and publish ------------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to mission subscriber")
        void deliversEventToMissionSubscriber() {
            List<RexEvent> received = new ArrayList<>();
            eventBus.subscribe("M-001", received::add);

            eventBus.publish(event(RexEventTypes.MISSION_CREATED, "M-001"));

            assertEquals(1, received.size());
            assertEquals(RexEventTypes.MISSION_CREATED, received.get(0).eventType());
        }

        @Test
        @DisplayName("does not deliver events for other missions")
        void ignoresOtherMissions() {
            List<RexEvent> received = new ArrayList<>();
            eventBus.subscribe("M-001", received::add);

            eventBus.publish(event(RexEventTypes.MISSION_CREATED, "M-002"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("type subscribers see every mission's events of that type")
        void typeSubscriberReceivesMatchingType() {
            List<RexEvent> received = new ArrayList<>();
            eventBus.subscribeType(RexEventTypes.LEASE_RELEASED, received::add);

            eventBus.publish(event(RexEventTypes.LEASE_RELEASED, "M-001"));
            eventBus.publish(event(RexEventTypes.LEASE_GRANTED, "M-001"));
            eventBus.publish(event(RexEventTypes.LEASE_RELEASED, "M-002"));
            eventBus.publish(event(RexEventTypes.LEASE_RELEASED, null));

            assertEquals(3, received.size());
            assertTrue(received.stream().allMatch(e -> e.eventType().equals(RexEventTypes.LEASE_RELEASED)));
        }

        @Test
        @DisplayName("global subscriber receives events without a mission id")
        void globalSubscriberReceivesPoolEvents() {
            List<RexEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(RexEventTypes.POOL_EXHAUSTED, null));

            assertEquals(1, received.size());
            assertNull(received.get(0).missionId());
        }

        @Test
        @DisplayName("an event matching several registrations reaches each once")
        void deliversToEachRegistration() {
            List<String> received = new ArrayList<>();
            eventBus.subscribe("M-001", e -> received.add("mission"));
            eventBus.subscribeType(RexEventTypes.MISSION_FAILED, e -> received.add("type"));
            eventBus.subscribeAll(e -> received.add("global"));

            eventBus.publish(event(RexEventTypes.MISSION_FAILED, "M-001"));

            assertEquals(List.of("mission", "type", "global"), received);
            assertEquals(1, eventBus.publishedCount());
        }
    }

    // -- Unsubscribe ----------------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery after unsubscribe")
        void stopsDelivery() {
            List<RexEvent> received = new ArrayList<>();
            var missionSub = eventBus.subscribe("M-001", received::add);
            var typeSub = eventBus.subscribeType(RexEventTypes.MISSION_CREATED, received::add);
            var globalSub = eventBus.subscribeAll(received::add);

            missionSub.unsubscribe();
            typeSub.unsubscribe();
            globalSub.unsubscribe();
            eventBus.publish(event(RexEventTypes.MISSION_CREATED, "M-001"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("unsubscribing twice is harmless")
        void unsubscribeTwice() {
            var sub = eventBus.subscribe("M-001", e -> {});
            sub.unsubscribe();
            assertDoesNotThrow(sub::unsubscribe);
        }
    }

    // -- Failure isolation ----------------------------------------------------

    @Nested
    @DisplayName("failing subscribers")
    class FailingSubscriberTests {

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void isolatesFailures() {
            List<RexEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> { throw new IllegalStateException("dashboard offline"); });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(RexEventTypes.MISSION_CREATED, "M-001")));

            assertEquals(1, received.size());
            assertEquals(1, eventBus.failedDeliveryCount());
        }

        @Test
        @DisplayName("records the failed event as a dead letter")
        void recordsDeadLetter() {
            eventBus.subscribeType(RexEventTypes.MISSION_FAILED, e -> { throw new IllegalStateException("boom"); });

            eventBus.publish(event(RexEventTypes.MISSION_FAILED, "M-007"));

            var letters = eventBus.deadLetters();
            assertEquals(1, letters.size());
            assertEquals("M-007", letters.get(0).event().missionId());
            assertEquals("boom", letters.get(0).error());

            eventBus.clearDeadLetters();
            assertTrue(eventBus.deadLetters().isEmpty());
        }

        @Test
        @DisplayName("dead letters are bounded, oldest dropped first")
        void deadLettersAreBounded() {
            eventBus.subscribeAll(e -> { throw new IllegalStateException("down"); });

            for (int i = 0; i < EventBus.DEAD_LETTER_CAPACITY + 5; i++) {
                eventBus.publish(event(RexEventTypes.MISSION_CREATED, "M-" + i));
            }

            var letters = eventBus.deadLetters();
            assertEquals(EventBus.DEAD_LETTER_CAPACITY, letters.size());
            assertEquals("M-5", letters.get(0).event().missionId());
        }
    }

    // -- Concurrency ----------------------------------------------------------

    @Test
    @DisplayName("concurrent publishers deliver every event")
    void concurrentPublish() throws InterruptedException {
        List<RexEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(received::add);
        int threads = 8;
        int perThread = 50;
        var done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            int id = t;
            new Thread(() -> {
                for (int i = 0; i < perThread; i++) {
                    eventBus.publish(event(RexEventTypes.MISSION_STATE_CHANGED, "M-" + id));
                }
                done.countDown();
            }).start();
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(threads * perThread, received.size());
    }
}
