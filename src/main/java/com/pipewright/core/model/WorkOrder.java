package com.pipewright.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * A single unit of requested work, handed to an external executor as instruction text.
 * <p>
 * Work orders are immutable; every lifecycle change produces a copy through
 * {@link #withStatus}, which refuses to move the status backwards.
 *
 * @param taskId          unique identifier within its pipeline run (e.g. "impl-1")
 * @param executorId      the executor expected to carry out the work
 * @param description     short summary of what should be accomplished
 * @param instructionText free-text task specification, opaque to the scheduler
 * @param dependencies    task ids that must be handled first (dependency-graph dispatch only)
 * @param timeout         how long the executor is given for this work order
 * @param critical        whether failure of this order should be treated as critical
 * @param status          current lifecycle status
 * @param result          opaque result reported for this order (null until produced)
 * @param error           failure description (null unless FAILED)
 * @param startedAt       when dispatch started
 * @param endedAt         when dispatch finished
 */
public record WorkOrder(
    String taskId,
    String executorId,
    String description,
    String instructionText,
    Set<String> dependencies,
    Duration timeout,
    boolean critical,
    WorkOrderStatus status,
    Map<String, Object> result,
    String error,
    Instant startedAt,
    Instant endedAt
) implements Serializable {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    public WorkOrder {
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        status = status == null ? WorkOrderStatus.PENDING : status;
    }

    public static WorkOrder pending(String taskId, String executorId, String description,
                                    String instructionText) {
        return new WorkOrder(taskId, executorId, description, instructionText, Set.of(),
                DEFAULT_TIMEOUT, false, WorkOrderStatus.PENDING, null, null, null, null);
    }

    public static WorkOrder pending(String taskId, String executorId, String description,
                                    String instructionText, Set<String> dependencies) {
        return new WorkOrder(taskId, executorId, description, instructionText, dependencies,
                DEFAULT_TIMEOUT, false, WorkOrderStatus.PENDING, null, null, null, null);
    }

    /**
     * Returns a copy in the given status.
     *
     * @throws IllegalStateException if the transition would move the status backwards
     */
    public WorkOrder withStatus(WorkOrderStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Work order " + taskId + " cannot move from " + status + " to " + next);
        }
        return new WorkOrder(taskId, executorId, description, instructionText, dependencies,
                timeout, critical, next, result, error, startedAt, endedAt);
    }

    /** Returns a copy with replaced dependencies, keeping status and results. */
    public WorkOrder withDependencies(Set<String> newDependencies) {
        return new WorkOrder(taskId, executorId, description, instructionText, newDependencies,
                timeout, critical, status, result, error, startedAt, endedAt);
    }

    public WorkOrder dispatched(Instant at) {
        var next = withStatus(WorkOrderStatus.DISPATCHED);
        return new WorkOrder(taskId, executorId, description, instructionText, dependencies,
                timeout, critical, next.status(), result, error, at, endedAt);
    }

    public WorkOrder completed(Map<String, Object> producedResult, Instant at) {
        var next = withStatus(WorkOrderStatus.COMPLETED);
        return new WorkOrder(taskId, executorId, description, instructionText, dependencies,
                timeout, critical, next.status(), producedResult, null, startedAt, at);
    }

    public WorkOrder failed(String failure, Instant at) {
        var next = withStatus(WorkOrderStatus.FAILED);
        return new WorkOrder(taskId, executorId, description, instructionText, dependencies,
                timeout, critical, next.status(), result, failure, startedAt, at);
    }

    /**
     * Returns a fresh PENDING copy carrying a replacement instruction and executor,
     * used when a stage is re-entered with remediation instructions.
     */
    public WorkOrder reissue(String newExecutorId, String newInstructionText) {
        return new WorkOrder(taskId,
                newExecutorId != null ? newExecutorId : executorId,
                description,
                newInstructionText != null ? newInstructionText : instructionText,
                dependencies, timeout, critical, WorkOrderStatus.PENDING, null, null, null, null);
    }

    /** The instruction text produced for this order, if production succeeded. */
    public String producedInstruction() {
        if (result == null) return null;
        Object instruction = result.get("instruction");
        return instruction != null ? instruction.toString() : null;
    }
}
