package com.pipewright.core.state;

import com.pipewright.core.model.FeedbackContext;
import com.pipewright.core.model.LoopOutcome;
import com.pipewright.core.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private FeedbackStore store;

    @BeforeEach
    void setUp() {
        store = new FeedbackStore();
    }

    private static FeedbackContext loop(String loopId, String workOrderId, Instant createdAt) {
        return FeedbackContext.open(loopId, "R", "implementation", "coder", workOrderId, "do it", 3, createdAt);
    }

    private FeedbackContext register(String loopId, String workOrderId) {
        return store.registerIfAbsent(FeedbackContext.key("R", "implementation", workOrderId),
                () -> loop(loopId, workOrderId, T0));
    }

    @Test
    @DisplayName("registerIfAbsent keeps the first loop for a key")
    void registerIfAbsent() {
        var first = register("L1", "impl-1");
        var second = register("L2", "impl-1");

        assertEquals("L1", first.loopId());
        assertEquals("L1", second.loopId());
        assertEquals(1, store.activeLoops().size());
        assertEquals("L1", store.findActive("R", "implementation", "impl-1").orElseThrow().loopId());
    }

    @Test
    @DisplayName("concurrent registration for the same key opens exactly one loop")
    void concurrentRegistration() throws Exception {
        var created = new AtomicInteger();
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            var futures = new ArrayList<Future<String>>();
            for (int i = 0; i < 8; i++) {
                String candidate = "L" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.registerIfAbsent(FeedbackContext.key("R", "implementation", "impl-1"), () -> {
                        created.incrementAndGet();
                        return loop(candidate, "impl-1", T0);
                    }).loopId();
                }));
            }
            start.countDown();
            var ids = new ArrayList<String>();
            for (Future<String> future : futures) {
                ids.add(future.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, created.get());
            assertEquals(1, ids.stream().distinct().count());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("update replaces the active context")
    void update() {
        register("L1", "impl-1");

        var updated = store.update("L1", c -> c.withFailure(ValidationResult.passed(), "boom", T0.plusSeconds(5)));

        assertEquals(1, updated.retryCount());
        assertEquals(1, store.find("L1").orElseThrow().retryCount());
    }

    @Test
    @DisplayName("updating an unknown loop fails")
    void updateUnknown() {
        assertThrows(IllegalArgumentException.class, () -> store.update("missing", c -> c));
    }

    @Test
    @DisplayName("closing moves a loop to history and frees its key")
    void close() {
        register("L1", "impl-1");

        var entry = store.close("L1", LoopOutcome.SUCCEEDED, T0.plusSeconds(60));

        assertTrue(entry.isPresent());
        assertTrue(store.find("L1").isEmpty());
        assertTrue(store.findActive("R", "implementation", "impl-1").isEmpty());
        assertEquals(List.of("L1"), store.history().stream().map(e -> e.loopId()).toList());
        assertTrue(store.close("L1", LoopOutcome.SUCCEEDED, T0.plusSeconds(61)).isEmpty());
        assertEquals(1, store.history().size());
    }

    @Test
    @DisplayName("escalation archives the loop and activates its successor under the same key")
    void escalate() {
        var original = register("L1", "impl-1");
        var successor = original.escalatedTo("L1-esc", "specialist", "do it", T0.plusSeconds(30));

        store.escalate("L1", successor, T0.plusSeconds(30));

        assertEquals(LoopOutcome.ESCALATED, store.history().get(0).outcome());
        assertEquals("L1-esc", store.findActive("R", "implementation", "impl-1").orElseThrow().loopId());
        assertThrows(IllegalArgumentException.class, () -> store.escalate("L1", successor, T0));
    }

    @Test
    @DisplayName("expiry archives loops created before the cutoff")
    void expire() {
        store.registerIfAbsent("k1", () -> loop("old", "impl-1", T0));
        store.registerIfAbsent("k2", () -> loop("new", "impl-2", T0.plus(Duration.ofHours(2))));

        int removed = store.expireOlderThan(T0.plus(Duration.ofHours(1)), T0.plus(Duration.ofHours(3)));

        assertEquals(1, removed);
        assertEquals(List.of("new"), store.activeLoops().stream().map(FeedbackContext::loopId).toList());
        assertEquals(LoopOutcome.EXPIRED, store.history().get(0).outcome());
    }

    @Test
    @DisplayName("active loops and history are filtered by run")
    void filterByRun() {
        register("L1", "impl-1");
        store.registerIfAbsent(FeedbackContext.key("S", "implementation", "impl-1"),
                () -> FeedbackContext.open("S1", "S", "implementation", "coder", "impl-1", "x", 3, T0));

        assertEquals(1, store.activeLoops("R").size());
        assertEquals(1, store.activeLoops("S").size());
        assertEquals(2, store.activeLoops().size());
    }
}
