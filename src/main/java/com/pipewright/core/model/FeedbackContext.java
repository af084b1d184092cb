package com.pipewright.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks one unresolved validation failure (a "feedback loop") and its remediation attempts.
 * <p>
 * At most one active context exists per {@code (runId, stage, workOrderId)}; see {@link #key()}.
 * An escalated successor keeps the {@code rootLoopId} of the loop it replaced.
 *
 * @param loopId              unique loop identifier
 * @param rootLoopId          loop id of the first loop in an escalation chain
 * @param runId               orchestrated run this loop belongs to
 * @param stage               stage name whose work failed validation
 * @param executorId          executor currently responsible for the remediation
 * @param workOrderId         work order under remediation
 * @param originalInstruction instruction text the executor was originally given
 * @param validationResult    last reported validation result (null before the first report)
 * @param failureReason       last failure reason ("" before the first failure)
 * @param retryCount          failures recorded so far; never exceeds {@code maxRetries}
 * @param maxRetries          upper bound for {@code retryCount}
 * @param createdAt           when the root loop was opened
 * @param updatedAt           last modification
 * @param escalated           whether this loop chain has already been escalated once
 * @param failureHistory      every failure reason recorded for this loop chain, oldest first
 */
public record FeedbackContext(
    String loopId,
    String rootLoopId,
    String runId,
    String stage,
    String executorId,
    String workOrderId,
    String originalInstruction,
    ValidationResult validationResult,
    String failureReason,
    int retryCount,
    int maxRetries,
    Instant createdAt,
    Instant updatedAt,
    boolean escalated,
    List<String> failureHistory
) implements Serializable {

    public FeedbackContext {
        rootLoopId = rootLoopId == null ? loopId : rootLoopId;
        failureReason = failureReason == null ? "" : failureReason;
        failureHistory = failureHistory == null ? List.of() : List.copyOf(failureHistory);
    }

    public static FeedbackContext open(String loopId, String runId, String stage, String executorId,
                                       String workOrderId, String originalInstruction,
                                       int maxRetries, Instant now) {
        return new FeedbackContext(loopId, loopId, runId, stage, executorId, workOrderId,
                originalInstruction, null, "", 0, maxRetries, now, now, false, List.of());
    }

    public static String key(String runId, String stage, String workOrderId) {
        return runId + "/" + stage + "/" + workOrderId;
    }

    public String key() {
        return key(runId, stage, workOrderId);
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    /**
     * Records one more validation failure. The retry count grows by one but is capped at
     * {@code maxRetries}.
     */
    public FeedbackContext withFailure(ValidationResult result, String reason, Instant now) {
        var history = new ArrayList<>(failureHistory);
        history.add(reason);
        int nextCount = Math.min(retryCount + 1, maxRetries);
        return new FeedbackContext(loopId, rootLoopId, runId, stage, executorId, workOrderId,
                originalInstruction, result, reason, nextCount, maxRetries, createdAt, now,
                escalated, history);
    }

    public FeedbackContext withValidation(ValidationResult result, Instant now) {
        return new FeedbackContext(loopId, rootLoopId, runId, stage, executorId, workOrderId,
                originalInstruction, result, failureReason, retryCount, maxRetries, createdAt, now,
                escalated, failureHistory);
    }

    /**
     * Successor loop bound to a different executor. Retry count, failure history and creation
     * time carry over so the abort ceiling keeps applying to the whole chain.
     */
    public FeedbackContext escalatedTo(String newLoopId, String targetExecutor, String newInstruction,
                                       Instant now) {
        return new FeedbackContext(newLoopId, rootLoopId, runId, stage, targetExecutor, workOrderId,
                newInstruction, validationResult, failureReason, retryCount, maxRetries, createdAt, now,
                true, failureHistory);
    }
}
