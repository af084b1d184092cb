package com.pipewright.core.orchestrator;

import com.pipewright.core.model.FeedbackDecision;
import com.pipewright.core.model.ValidationResult;
import com.pipewright.core.model.WorkOrder;

import java.util.List;

/**
 * Outcome of one stage within a run.
 *
 * @param stage      stage name
 * @param status     final status
 * @param workOrders latest state of each of the stage's work orders
 * @param validation last validation result (null if the stage never ran)
 * @param loopIds    feedback loops the stage opened or reused
 * @param retryCount retries and escalations decided for the stage's loops
 * @param entries    how often the stage was entered
 * @param decisions  every decision taken for the stage, in order
 * @param terminal   true when the stage failed with no recourse (a loop was aborted)
 */
public record StageResult(
    String stage,
    StageStatus status,
    List<WorkOrder> workOrders,
    ValidationResult validation,
    List<String> loopIds,
    int retryCount,
    int entries,
    List<FeedbackDecision> decisions,
    boolean terminal
) {

    public StageResult {
        workOrders = workOrders == null ? List.of() : List.copyOf(workOrders);
        loopIds = loopIds == null ? List.of() : List.copyOf(loopIds);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    /** Failed with feedback loops still open, so the stage can be picked up again. */
    public boolean recoverable() {
        return status == StageStatus.FAILED && !terminal;
    }
}
