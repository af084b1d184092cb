package com.pipewright.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkOrderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private static WorkOrder order() {
        return WorkOrder.pending("impl-1", "python-pro", "Add sum", "def sum(a, b)");
    }

    @Test
    @DisplayName("moves forward through dispatch to completion")
    void forwardTransitions() {
        var completed = order().dispatched(NOW).completed(Map.of("instruction", "do it"), NOW.plusSeconds(1));

        assertEquals(WorkOrderStatus.COMPLETED, completed.status());
        assertEquals(NOW, completed.startedAt());
        assertEquals(NOW.plusSeconds(1), completed.endedAt());
        assertEquals("do it", completed.producedInstruction());
    }

    @Test
    @DisplayName("a terminal work order never changes status again")
    void terminalIsFinal() {
        var failed = order().dispatched(NOW).failed("boom", NOW);

        assertThrows(IllegalStateException.class, () -> failed.withStatus(WorkOrderStatus.DISPATCHED));
        assertThrows(IllegalStateException.class, () -> failed.completed(Map.of(), NOW));
        assertEquals("boom", failed.error());
    }

    @Test
    @DisplayName("a dispatched work order cannot go back to pending")
    void noBackwardMove() {
        assertThrows(IllegalStateException.class,
                () -> order().dispatched(NOW).withStatus(WorkOrderStatus.PENDING));
    }

    @Test
    @DisplayName("reissue returns a fresh pending copy with the new executor and instruction")
    void reissue() {
        var reissued = order().dispatched(NOW).failed("boom", NOW).reissue("code-reviewer", "fix it");

        assertEquals(WorkOrderStatus.PENDING, reissued.status());
        assertEquals("code-reviewer", reissued.executorId());
        assertEquals("fix it", reissued.instructionText());
        assertNull(reissued.error());
        assertNull(reissued.result());
        assertEquals("python-pro", order().reissue(null, null).executorId());
    }

    @Test
    @DisplayName("defaults are filled in")
    void defaults() {
        var bare = new WorkOrder("x", "e", null, "t", null, null, false, null, null, null, null, null);

        assertEquals(WorkOrderStatus.PENDING, bare.status());
        assertEquals(WorkOrder.DEFAULT_TIMEOUT, bare.timeout());
        assertTrue(bare.dependencies().isEmpty());
        assertNull(bare.producedInstruction());
    }
}
