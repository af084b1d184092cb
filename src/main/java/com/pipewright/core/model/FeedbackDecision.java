package com.pipewright.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of analysing a validated attempt. Each action carries only the fields it needs.
 */
public sealed interface FeedbackDecision extends Serializable
        permits FeedbackDecision.Remediation, FeedbackDecision.Abort,
                FeedbackDecision.Continue, FeedbackDecision.Rollback {

    /** Loop the decision was taken for. */
    String loopId();

    FeedbackAction action();

    String reasoning();

    /**
     * A decision that hands new instructions to an executor.
     */
    sealed interface Remediation extends FeedbackDecision permits Retry, Escalate {

        String targetExecutor();

        String instruction();

        Map<String, Object> validationRequirements();

        Map<String, String> successCriteria();

        double confidence();

        Duration estimatedRemediationTime();

        FeedbackSeverity severity();
    }

    /** Same executor, augmented instruction. */
    record Retry(
        String loopId,
        String targetExecutor,
        String instruction,
        Map<String, Object> validationRequirements,
        Map<String, String> successCriteria,
        double confidence,
        Duration estimatedRemediationTime,
        FeedbackSeverity severity,
        String reasoning
    ) implements Remediation {

        public Retry {
            validationRequirements = ordered(validationRequirements);
            successCriteria = ordered(successCriteria);
        }

        @Override
        public FeedbackAction action() {
            return FeedbackAction.RETRY;
        }
    }

    /**
     * Different executor. {@code successorLoopId} is the loop opened for the target executor.
     */
    record Escalate(
        String loopId,
        String successorLoopId,
        String previousExecutor,
        String targetExecutor,
        String instruction,
        Map<String, Object> validationRequirements,
        Map<String, String> successCriteria,
        double confidence,
        Duration estimatedRemediationTime,
        FeedbackSeverity severity,
        String reasoning
    ) implements Remediation {

        public Escalate {
            validationRequirements = ordered(validationRequirements);
            successCriteria = ordered(successCriteria);
        }

        public Escalate withSuccessorLoopId(String successor) {
            return new Escalate(loopId, successor, previousExecutor, targetExecutor, instruction,
                    validationRequirements, successCriteria, confidence, estimatedRemediationTime,
                    severity, reasoning);
        }

        @Override
        public FeedbackAction action() {
            return FeedbackAction.ESCALATE;
        }
    }

    record Abort(String loopId, FeedbackSeverity severity, String reasoning) implements FeedbackDecision {
        @Override
        public FeedbackAction action() {
            return FeedbackAction.ABORT;
        }
    }

    record Continue(String loopId, String reasoning) implements FeedbackDecision {
        @Override
        public FeedbackAction action() {
            return FeedbackAction.CONTINUE;
        }
    }

    /**
     * A verification failure blamed on another stage's artifact. The verifier loop stays open
     * while {@code redirectedLoopId} on {@code targetStage} is remediated.
     */
    record Rollback(
        String loopId,
        String targetStage,
        String redirectedLoopId,
        FeedbackDecision remediation,
        String instruction,
        String reasoning
    ) implements FeedbackDecision {
        @Override
        public FeedbackAction action() {
            return FeedbackAction.ROLLBACK;
        }
    }

    private static <V> Map<String, V> ordered(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
