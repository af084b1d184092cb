package com.pipewright.core.events;

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

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static PipelineEvent event(String type, String runId) {
        return new PipelineEvent(type, runId, null, Map.of(), Instant.now());
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to run subscriber")
        void deliversToRunSubscriber() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("PIPE-1", received::add);

            var published = new PipelineEvent("stage.started", "PIPE-1", "testing", Map.of("entry", 1), Instant.now());
            eventBus.publish(published);

            assertEquals(List.of(published), received);
        }

        @Test
        @DisplayName("does not deliver events of another run")
        void ignoresOtherRuns() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("PIPE-2", received::add);

            eventBus.publish(event("run.started", "PIPE-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers events in publish order")
        void preservesOrder() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("PIPE-1", received::add);

            eventBus.publish(event("run.started", "PIPE-1"));
            eventBus.publish(event("stage.started", "PIPE-1"));
            eventBus.publish(event("run.completed", "PIPE-1"));

            assertEquals(List.of("run.started", "stage.started", "run.completed"),
                    received.stream().map(PipelineEvent::eventType).toList());
        }
    }

    // -- Global subscription tests --------------------------------------------

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("global subscriber receives events of every run")
        void receivesAllRuns() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("run.started", "PIPE-1"));
            eventBus.publish(event("batch.dispatched", "BATCH-1"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribing stops delivery")
        void unsubscribe() {
            List<PipelineEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);
            eventBus.publish(event("run.started", "PIPE-1"));

            subscription.unsubscribe();
            eventBus.publish(event("run.completed", "PIPE-1"));

            assertEquals(1, received.size());
        }
    }

    // -- Type prefix tests ----------------------------------------------------

    @Nested
    @DisplayName("event type prefix")
    class TypePrefixTests {

        @Test
        @DisplayName("run subscriber with a prefix only sees matching event types")
        void runPrefix() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("PIPE-1", "feedback.", received::add);

            eventBus.publish(event("stage.started", "PIPE-1"));
            eventBus.publish(event("feedback.retry", "PIPE-1"));
            eventBus.publish(event("feedback.rerouted", "PIPE-1"));
            eventBus.publish(event("feedback.retry", "PIPE-2"));

            assertEquals(List.of("feedback.retry", "feedback.rerouted"),
                    received.stream().map(PipelineEvent::eventType).toList());
        }

        @Test
        @DisplayName("global subscriber with a prefix sees matching events of every run")
        void globalPrefix() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribeAll("stage.", received::add);

            eventBus.publish(event("stage.suspended", "PIPE-1"));
            eventBus.publish(event("run.completed", "PIPE-1"));
            eventBus.publish(event("stage.failed", "PIPE-2"));

            assertEquals(List.of("PIPE-1", "PIPE-2"), received.stream().map(PipelineEvent::runId).toList());
        }

        @Test
        @DisplayName("the last unsubscribe of a run drops the run's entry")
        void runEntryDropped() {
            EventBus.Subscription first = eventBus.subscribe("PIPE-1", "feedback.", e -> { });
            EventBus.Subscription second = eventBus.subscribe("PIPE-1", e -> { });
            assertEquals(1, eventBus.subscribedRuns());

            first.unsubscribe();
            assertEquals(1, eventBus.subscribedRuns());
            second.unsubscribe();
            assertEquals(0, eventBus.subscribedRuns());
        }
    }

    // -- Edge cases -----------------------------------------------------------

    @Nested
    @DisplayName("edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void throwingSubscriber() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("PIPE-1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("PIPE-1", received::add);

            eventBus.publish(event("run.started", "PIPE-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes safely")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<PipelineEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("PIPE-1", received::add);

            int threads = 8;
            int perThread = 50;
            CountDownLatch latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(event("feedback.retry", "PIPE-1"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
