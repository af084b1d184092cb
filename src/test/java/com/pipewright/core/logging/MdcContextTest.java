package com.pipewright.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setStage puts runId and stage in MDC")
    void setStage() {
        MdcContext.setStage("PIPE-2026-0001", "testing");
        assertEquals("PIPE-2026-0001", MDC.get("runId"));
        assertEquals("testing", MDC.get("stage"));
    }

    @Test
    @DisplayName("setWorkOrder puts runId, workOrderId and executorId in MDC")
    void setWorkOrder() {
        MdcContext.setWorkOrder("BATCH-2026-0001", "impl-1", "python-pro");
        assertEquals("BATCH-2026-0001", MDC.get("runId"));
        assertEquals("impl-1", MDC.get("workOrderId"));
        assertEquals("python-pro", MDC.get("executorId"));
    }

    @Test
    @DisplayName("clearWorkOrder keeps run and stage")
    void clearWorkOrder() {
        MdcContext.setStage("PIPE-2026-0001", "testing");
        MdcContext.setWorkOrder("PIPE-2026-0001", "test-1", "test-engineer");

        MdcContext.clearWorkOrder();

        assertEquals("PIPE-2026-0001", MDC.get("runId"));
        assertEquals("testing", MDC.get("stage"));
        assertNull(MDC.get("workOrderId"));
        assertNull(MDC.get("executorId"));
    }

    @Test
    @DisplayName("clear removes all pipeline MDC keys")
    void clear() {
        MdcContext.setStage("PIPE-2026-0001", "testing");
        MdcContext.setWorkOrder("PIPE-2026-0001", "test-1", "test-engineer");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("stage"));
        assertNull(MDC.get("workOrderId"));
        assertNull(MDC.get("executorId"));
    }
}
