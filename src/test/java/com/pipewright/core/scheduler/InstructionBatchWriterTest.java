package com.pipewright.core.scheduler;

import com.pipewright.core.model.DispatchMode;
import com.pipewright.core.model.WorkOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstructionBatchWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("lists only produced instructions, numbered in order")
    void listsProducedInstructions() {
        var done = WorkOrder.pending("a", "python-pro", "A", "a").dispatched(NOW)
                .completed(Map.of("instruction", "build a"), NOW);
        var failed = WorkOrder.pending("b", "python-pro", "B", "b").dispatched(NOW).failed("boom", NOW);
        var pending = WorkOrder.pending("c", "python-pro", "C", "c");

        String batch = InstructionBatchWriter.render("BATCH-2026-0007", DispatchMode.SEQUENTIAL,
                List.of(done, failed, pending), 1, 1, NOW);

        assertTrue(batch.startsWith("# Instruction Batch: BATCH-2026-0007"));
        assertTrue(batch.contains("- **Total work orders:** 3"));
        assertTrue(batch.contains("- **Generated:** 2026-03-01T10:00:00Z"));
        assertTrue(batch.contains("Invoke the entries one at a time"));
        assertTrue(batch.contains("### 1. a\n\ninvoke executor=\"python-pro\" task=\"a\"\n\n```text\nbuild a\n```"));
        assertFalse(batch.contains("### 2."));
    }

    @Test
    @DisplayName("says so when nothing was produced")
    void nothingProduced() {
        String batch = InstructionBatchWriter.render("BATCH-2026-0008", DispatchMode.PARALLEL, List.of(), 0, 0, NOW);

        assertTrue(batch.contains("_No instructions were produced._"));
    }
}
