package com.pipewright.core.feedback;

import com.pipewright.config.PipelineProperties;
import com.pipewright.core.events.EventBus;
import com.pipewright.core.events.PipelineEvent;
import com.pipewright.core.metrics.PipelineMetrics;
import com.pipewright.core.model.FailureOrigin;
import com.pipewright.core.model.FailureRecord;
import com.pipewright.core.model.FeedbackContext;
import com.pipewright.core.model.FeedbackDecision;
import com.pipewright.core.model.FeedbackHistoryEntry;
import com.pipewright.core.model.FeedbackSeverity;
import com.pipewright.core.model.LoopOutcome;
import com.pipewright.core.model.QualityGateResult;
import com.pipewright.core.model.RetryStrategy;
import com.pipewright.core.model.StagePolicy;
import com.pipewright.core.model.ValidationResult;
import com.pipewright.core.state.FeedbackStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides what happens after an executor's work fails validation: retry with the same executor,
 * escalate to a specialist, or abort.
 * <p>
 * Every (run, stage, work order) has at most one open feedback loop in the {@link FeedbackStore}.
 * A failure raises the loop's retry count, then the loop is analysed in a fixed order:
 * <ol>
 *   <li>severity classification</li>
 *   <li>abort: retry budget spent, an abort keyword in the failure reason, or the loop is
 *       older than the loop ceiling</li>
 *   <li>escalation: the escalation threshold is reached (a loop escalates at most once)</li>
 *   <li>retry with an augmented instruction</li>
 * </ol>
 * Verification failures blamed on a produced artifact are rerouted to the producing stage.
 */
@Service
public class FeedbackDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(FeedbackDecisionEngine.class);

    static final double ESCALATION_CONFIDENCE = 0.7;
    static final Duration ESCALATION_ESTIMATE = Duration.ofSeconds(600);
    static final int BASE_REMEDIATION_SECONDS = 300;
    static final int BASE_TIMEOUT_SECONDS = 300;
    static final int BASE_BACKOFF_SECONDS = 30;
    static final int RECENT_HISTORY_SIZE = 5;
    static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    private final FeedbackStore store;
    private final StagePolicyRegistry policies;
    private final SeverityClassifier severityClassifier;
    private final FailureOriginClassifier originClassifier;
    private final Duration loopCeiling;
    private final Clock clock;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    @Autowired
    public FeedbackDecisionEngine(FeedbackStore store, PipelineProperties properties,
                                  EventBus eventBus, PipelineMetrics metrics) {
        this(store, StagePolicyRegistry.fromProperties(properties), SeverityClassifier.defaults(),
                FailureOriginClassifier.defaults(), properties.getFeedback().getLoopCeiling(),
                Clock.systemUTC(), eventBus, metrics);
    }

    public FeedbackDecisionEngine(FeedbackStore store, StagePolicyRegistry policies,
                                  SeverityClassifier severityClassifier,
                                  FailureOriginClassifier originClassifier, Duration loopCeiling,
                                  Clock clock, EventBus eventBus, PipelineMetrics metrics) {
        this.store = store;
        this.policies = policies;
        this.severityClassifier = severityClassifier;
        this.originClassifier = originClassifier;
        this.loopCeiling = loopCeiling;
        this.clock = clock;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public boolean hasPolicy(String stage) {
        return policies.hasPolicy(stage);
    }

    /**
     * Opens a feedback loop for a work order, or returns the one already open for it so that
     * retry counts survive a stage being entered again.
     *
     * @return the loop id
     * @throws com.pipewright.core.ConfigurationException if the stage has no policy
     */
    public String register(String runId, String stage, String executorId, String workOrderId,
                           String originalInstruction) {
        StagePolicy policy = policies.policyFor(stage);
        String key = FeedbackContext.key(runId, stage, workOrderId);
        FeedbackContext context = store.registerIfAbsent(key, () -> {
            String loopId = newLoopId(runId, stage, workOrderId);
            log.info("Opening feedback loop {} for {} [{}]", loopId, workOrderId, executorId);
            return FeedbackContext.open(loopId, runId, stage, executorId, workOrderId, originalInstruction,
                    policy.retryStrategy().maxAttempts(), clock.instant());
        });
        return context.loopId();
    }

    /**
     * Success if the validation passed, otherwise the failure is processed.
     */
    public FeedbackDecision evaluate(String loopId, ValidationResult validation, String failureReason) {
        if (validation.success()) {
            processValidationSuccess(loopId, validation);
            return new FeedbackDecision.Continue(loopId, "Validation passed");
        }
        return processValidationFailure(loopId, validation, failureReason);
    }

    /**
     * Records a failed attempt, decides what to do and applies the decision to the store.
     *
     * @param failureReason reason text; derived from the validation failures when null or blank
     * @throws IllegalArgumentException if the loop is not active
     */
    public FeedbackDecision processValidationFailure(String loopId, ValidationResult validation,
                                                     String failureReason) {
        Instant now = clock.instant();
        String reason = failureReason != null && !failureReason.isBlank()
                ? failureReason
                : describe(validation);
        FeedbackContext context = store.update(loopId, c -> c.withFailure(validation, reason, now));
        log.info("Validation failed for loop {} (attempt {}/{}): {}",
                loopId, context.retryCount(), context.maxRetries(), reason);

        FeedbackDecision decision = apply(analyzeFailure(context), context, now);

        if (metrics != null) {
            metrics.recordDecision(context.stage(), decision.action());
            metrics.recordRetryDepth(context.retryCount());
        }
        return decision;
    }

    /**
     * Closes the loop as SUCCEEDED.
     *
     * @return false if the loop was not active (already closed or unknown)
     */
    public boolean processValidationSuccess(String loopId, ValidationResult validation) {
        Instant now = clock.instant();
        Optional<FeedbackHistoryEntry> closed = store.close(loopId, LoopOutcome.SUCCEEDED, now,
                c -> c.withValidation(validation, now));
        if (closed.isEmpty()) {
            log.debug("Feedback loop {} is not active; nothing to close", loopId);
            return false;
        }
        FeedbackContext context = closed.get().context();
        log.info("Validation passed, closing feedback loop {} after {} failed attempts",
                loopId, context.retryCount());
        if (metrics != null) {
            metrics.recordLoopClosed(LoopOutcome.SUCCEEDED);
        }
        publish("feedback.resolved", context, Map.of("retryCount", context.retryCount()));
        return true;
    }

    /**
     * Decides what to do about a loop's latest failure. Reads the policy only; the store is
     * not touched.
     */
    public FeedbackDecision analyzeFailure(FeedbackContext context) {
        StagePolicy policy = policies.policyFor(context.stage());
        RetryStrategy strategy = policy.retryStrategy();
        FeedbackSeverity severity = severityClassifier.classify(context);

        Optional<String> abortReason = abortReason(context, strategy);
        if (abortReason.isPresent()) {
            return new FeedbackDecision.Abort(context.loopId(), severity, abortReason.get());
        }

        if (context.retryCount() >= strategy.escalationThreshold()) {
            if (context.escalated()) {
                return new FeedbackDecision.Abort(context.loopId(), severity,
                        "Still failing after escalation to " + context.executorId()
                                + "; a loop is escalated only once");
            }
            String target = escalationTarget(context, policy);
            if (target == null) {
                return new FeedbackDecision.Abort(context.loopId(), severity,
                        "Escalation threshold reached but no executor other than "
                                + context.executorId() + " is available");
            }
            return new FeedbackDecision.Escalate(
                    context.loopId(), null, context.executorId(), target,
                    RemediationPromptBuilder.escalationInstruction(context, policy, target),
                    validationRequirements(context, policy),
                    policy.allSuccessCriteria(),
                    ESCALATION_CONFIDENCE,
                    ESCALATION_ESTIMATE,
                    severity,
                    "Escalating from " + context.executorId() + " to " + target + " after "
                            + context.retryCount() + " failed attempts");
        }

        double confidence = Math.max(0.3, 0.9 - 0.2 * context.retryCount());
        long estimate = Math.round(BASE_REMEDIATION_SECONDS * (1 + 0.5 * context.retryCount()));
        return new FeedbackDecision.Retry(
                context.loopId(), context.executorId(),
                RemediationPromptBuilder.retryInstruction(context, policy, failingGates(context)),
                validationRequirements(context, policy),
                policy.allSuccessCriteria(),
                confidence,
                Duration.ofSeconds(estimate),
                severity,
                "Retry " + (context.retryCount() + 1) + " for " + context.executorId()
                        + ", previous failure: " + context.failureReason());
    }

    /**
     * Blame classification for a failure reported by a verifying stage.
     */
    public FailureOrigin classifyVerificationFailure(FailureRecord failure) {
        var rule = originClassifier.matchingRule(failure);
        log.debug("Failure {} classified as {} by rule '{}'", failure.type(), rule.origin(), rule.name());
        return rule.origin();
    }

    /**
     * Redirects a verification failure to the stage that produced the artifact. A loop is
     * opened (or reused) for the producer and the failure is processed there. The verifier's
     * loop stays open and its retry count is unchanged.
     *
     * @throws IllegalArgumentException if the verifier loop is not active
     */
    public FeedbackDecision.Rollback routeVerificationFailure(String verifierLoopId, ValidationResult validation,
                                                              FailureRecord failure, ArtifactProducer producer) {
        Instant now = clock.instant();
        FeedbackContext verifier = store.update(verifierLoopId, c -> c.withValidation(validation, now));

        String producerLoopId = register(verifier.runId(), producer.stage(), producer.executorId(),
                producer.workOrderId(), producer.originalInstruction());
        String reason = "Verification in stage " + verifier.stage() + " found an artifact defect: "
                + failure.summary();
        FeedbackDecision remediation = processValidationFailure(producerLoopId,
                ValidationResult.failed(failure), reason);

        String redirectedLoopId = remediation instanceof FeedbackDecision.Escalate escalate
                ? escalate.successorLoopId()
                : producerLoopId;
        log.info("Rerouted failure from {} loop {} to {} loop {} ({})",
                verifier.stage(), verifierLoopId, producer.stage(), redirectedLoopId, remediation.action());
        if (metrics != null) {
            metrics.recordReroute(verifier.stage(), producer.stage());
        }
        publish("feedback.rerouted", verifier, Map.of(
                "targetStage", producer.stage(),
                "targetLoopId", redirectedLoopId,
                "action", remediation.action().name()));

        return new FeedbackDecision.Rollback(verifierLoopId, producer.stage(), redirectedLoopId, remediation,
                RemediationPromptBuilder.rerouteInstruction(verifier, producer, failure, remediation),
                "Artifact defect reported by " + verifier.stage() + " routed to " + producer.stage()
                        + " executor " + producer.executorId());
    }

    public String renderDirective(FeedbackDecision decision) {
        return RemediationPromptBuilder.renderDirective(decision);
    }

    public Optional<FeedbackContext> findLoop(String loopId) {
        return store.find(loopId);
    }

    public FeedbackStatus feedbackStatus(String runId) {
        var active = store.activeLoops(runId);
        var closed = store.history(runId).stream()
                .filter(e -> e.outcome() != LoopOutcome.ESCALATED)
                .toList();

        // an escalated successor carries its predecessor's count, so only final loops are summed
        int totalRetries = active.stream().mapToInt(FeedbackContext::retryCount).sum()
                + closed.stream().mapToInt(e -> e.context().retryCount()).sum();
        long succeeded = closed.stream().filter(e -> e.outcome() == LoopOutcome.SUCCEEDED).count();
        double successRate = closed.isEmpty() ? 0.0 : (double) succeeded / closed.size();

        var all = store.history(runId);
        var recent = all.subList(Math.max(0, all.size() - RECENT_HISTORY_SIZE), all.size());

        var loops = active.stream()
                .map(c -> new FeedbackStatus.ActiveLoop(c.loopId(), c.stage(), c.executorId(),
                        c.retryCount(), c.failureReason()))
                .toList();
        return new FeedbackStatus(runId, loops, closed.size(), totalRetries, successRate, List.copyOf(recent));
    }

    public int cleanupExpiredLoops() {
        return cleanupExpiredLoops(DEFAULT_RETENTION);
    }

    /**
     * Archives active loops older than {@code maxAge} as EXPIRED.
     *
     * @return the number of loops removed
     */
    public int cleanupExpiredLoops(Duration maxAge) {
        Instant now = clock.instant();
        int removed = store.expireOlderThan(now.minus(maxAge), now);
        if (metrics != null) {
            for (int i = 0; i < removed; i++) {
                metrics.recordLoopClosed(LoopOutcome.EXPIRED);
            }
        }
        return removed;
    }

    private FeedbackDecision apply(FeedbackDecision decision, FeedbackContext context, Instant now) {
        if (decision instanceof FeedbackDecision.Escalate escalate) {
            var successor = context.escalatedTo(context.loopId() + "-esc", escalate.targetExecutor(),
                    context.originalInstruction(), now);
            store.escalate(context.loopId(), successor, now);
            if (metrics != null) {
                metrics.recordLoopClosed(LoopOutcome.ESCALATED);
            }
            log.warn("Escalated loop {} to {} as {}", context.loopId(), escalate.targetExecutor(), successor.loopId());
            publish("feedback.escalated", context, Map.of(
                    "targetExecutor", escalate.targetExecutor(),
                    "successorLoopId", successor.loopId()));
            return escalate.withSuccessorLoopId(successor.loopId());
        }
        if (decision instanceof FeedbackDecision.Abort abort) {
            store.close(context.loopId(), LoopOutcome.ABORTED, now);
            if (metrics != null) {
                metrics.recordLoopClosed(LoopOutcome.ABORTED);
            }
            log.warn("Aborting loop {}: {}", context.loopId(), abort.reasoning());
            publish("feedback.aborted", context, Map.of("reason", abort.reasoning()));
            return abort;
        }
        publish("feedback.retry", context, Map.of("retryCount", context.retryCount()));
        return decision;
    }

    private Optional<String> abortReason(FeedbackContext context, RetryStrategy strategy) {
        if (context.retryCount() >= strategy.maxAttempts()) {
            return Optional.of("Retry budget exhausted: " + context.retryCount() + " of "
                    + strategy.maxAttempts() + " attempts failed");
        }
        String reason = context.failureReason().toLowerCase(Locale.ROOT);
        for (String condition : strategy.abortConditions()) {
            if (reason.contains(condition.toLowerCase(Locale.ROOT))) {
                return Optional.of("Abort condition '" + condition + "' matched the failure reason");
            }
        }
        Duration age = context.age(clock.instant());
        if (age.compareTo(loopCeiling) > 0) {
            return Optional.of("Feedback loop open for " + age + ", longer than the " + loopCeiling + " ceiling");
        }
        return Optional.empty();
    }

    /**
     * First route whose keyword appears in the failure, then the stage default, then the global
     * fallback. Never the executor that just failed.
     */
    private String escalationTarget(FeedbackContext context, StagePolicy policy) {
        String text = failureText(context);
        for (var route : policy.escalationTargets().entrySet()) {
            if (text.contains(route.getKey().toLowerCase(Locale.ROOT))
                    && !route.getValue().equals(context.executorId())) {
                return route.getValue();
            }
        }
        String stageDefault = policy.defaultEscalationExecutor();
        if (stageDefault != null && !stageDefault.equals(context.executorId())) {
            return stageDefault;
        }
        if (!StagePolicyRegistry.FALLBACK_ESCALATION_EXECUTOR.equals(context.executorId())) {
            return StagePolicyRegistry.FALLBACK_ESCALATION_EXECUTOR;
        }
        return null;
    }

    private Map<String, Object> validationRequirements(FeedbackContext context, StagePolicy policy) {
        RetryStrategy strategy = policy.retryStrategy();
        int retries = context.retryCount();
        var requirements = new LinkedHashMap<String, Object>();
        requirements.put("stage", context.stage());
        requirements.put("attempt", retries + 1);
        requirements.put("previous_failures", context.failureHistory());
        requirements.put("success_criteria", policy.allSuccessCriteria());
        requirements.put("timeout_seconds",
                Math.round(BASE_TIMEOUT_SECONDS * Math.pow(strategy.timeoutMultiplier(), retries)));
        // a factor of 1.0 means retry immediately
        requirements.put("backoff_seconds",
                Math.round(BASE_BACKOFF_SECONDS * (Math.pow(strategy.backoffFactor(), retries) - 1)));
        requirements.put("validation_type", "enhanced");
        requirements.put("failure_sensitive", true);
        return requirements;
    }

    private List<QualityGateResult> failingGates(FeedbackContext context) {
        return context.validationResult() == null ? List.of() : context.validationResult().failingGates();
    }

    private String newLoopId(String runId, String stage, String workOrderId) {
        String key = FeedbackContext.key(runId, stage, workOrderId);
        long generation = store.history(runId).stream()
                .filter(e -> e.context().key().equals(key) && e.outcome() != LoopOutcome.ESCALATED)
                .count() + 1;
        return runId + ":" + stage + ":" + workOrderId + "#" + generation;
    }

    private static String failureText(FeedbackContext context) {
        var parts = new ArrayList<String>();
        parts.add(context.failureReason());
        if (context.validationResult() != null) {
            context.validationResult().failures().forEach(f -> parts.add(f.type()));
        }
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    private static String describe(ValidationResult validation) {
        if (validation.failures().isEmpty()) {
            return "validation failed";
        }
        return validation.failures().stream()
                .map(FailureRecord::summary)
                .collect(Collectors.joining("; "));
    }

    private void publish(String type, FeedbackContext context, Map<String, Object> payload) {
        var data = new LinkedHashMap<String, Object>(payload);
        data.put("stage", context.stage());
        data.put("executorId", context.executorId());
        data.put("workOrderId", context.workOrderId());
        eventBus.publish(new PipelineEvent(type, context.runId(), context.loopId(), data, clock.instant()));
    }
}
