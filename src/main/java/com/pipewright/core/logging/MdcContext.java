package com.pipewright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing pipeline MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String STAGE = "stage";
    public static final String WORK_ORDER_ID = "workOrderId";
    public static final String EXECUTOR_ID = "executorId";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setStage(String runId, String stage) {
        MDC.put(RUN_ID, runId);
        MDC.put(STAGE, stage);
    }

    public static void setWorkOrder(String runId, String workOrderId, String executorId) {
        MDC.put(RUN_ID, runId);
        MDC.put(WORK_ORDER_ID, workOrderId);
        MDC.put(EXECUTOR_ID, executorId);
    }

    /** Removes the work-order keys only; run and stage stay in place. */
    public static void clearWorkOrder() {
        MDC.remove(WORK_ORDER_ID);
        MDC.remove(EXECUTOR_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(STAGE);
        MDC.remove(WORK_ORDER_ID);
        MDC.remove(EXECUTOR_ID);
    }
}
