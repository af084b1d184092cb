package com.pipewright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of one scheduler invocation over a set of work orders.
 * Immutable once dispatch completes.
 *
 * @param runId            identifier of this dispatch (e.g. "BATCH-2026-0003")
 * @param mode             dispatch mode used
 * @param workOrders       work orders in their final state, in original (or sorted) order
 * @param status           COMPLETED when no work order failed
 * @param elapsedMs        wall-clock time spent producing instructions
 * @param successCount     work orders whose instruction was produced
 * @param failureCount     work orders whose instruction production failed
 * @param instructionBatch assembled batch document listing every produced instruction
 */
public record PipelineRun(
    String runId,
    DispatchMode mode,
    List<WorkOrder> workOrders,
    RunStatus status,
    long elapsedMs,
    int successCount,
    int failureCount,
    String instructionBatch
) implements Serializable {

    public PipelineRun {
        workOrders = workOrders == null ? List.of() : List.copyOf(workOrders);
    }

    public boolean succeeded() {
        return status == RunStatus.COMPLETED;
    }

    public List<WorkOrder> failedWorkOrders() {
        return workOrders.stream()
                .filter(w -> w.status() == WorkOrderStatus.FAILED)
                .toList();
    }

    public List<WorkOrder> pendingWorkOrders() {
        return workOrders.stream()
                .filter(w -> w.status() == WorkOrderStatus.PENDING)
                .toList();
    }
}
