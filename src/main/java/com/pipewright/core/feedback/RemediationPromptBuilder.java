package com.pipewright.core.feedback;

import com.pipewright.core.model.FailureRecord;
import com.pipewright.core.model.FeedbackContext;
import com.pipewright.core.model.FeedbackDecision;
import com.pipewright.core.model.QualityGateResult;
import com.pipewright.core.model.StagePolicy;
import com.pipewright.core.qualitygate.QualityGateRemediation;
import com.pipewright.core.scheduler.InstructionBatchWriter;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the instruction text handed to executors when a loop is retried, escalated or
 * rerouted, and renders decisions as invocation entries. Pure functions.
 */
public final class RemediationPromptBuilder {

    private RemediationPromptBuilder() {}

    public static String retryInstruction(FeedbackContext context, StagePolicy policy,
                                          List<QualityGateResult> failingGates) {
        var sb = new StringBuilder();

        sb.append("## Previous Attempt Failed\n\n");
        sb.append("- **Failure reason:** ").append(context.failureReason()).append("\n");
        sb.append("- **Failed attempts:** ").append(context.retryCount()).append("/")
          .append(policy.retryStrategy().maxAttempts()).append("\n");
        sb.append("- **Stage:** ").append(context.stage()).append("\n\n");
        appendReportedFailures(sb, context);

        sb.append("## Remediation Guidance\n\n");
        sb.append("**Focus on:**\n");
        for (String line : policy.guidance()) {
            sb.append("- ").append(line).append("\n");
        }

        String reason = context.failureReason().toLowerCase(Locale.ROOT);
        var hints = policy.retryStrategy().remediationHints().entrySet().stream()
                .filter(e -> reason.contains(e.getKey().toLowerCase(Locale.ROOT)))
                .map(Map.Entry::getValue)
                .toList();
        if (!hints.isEmpty()) {
            sb.append("\n**Specific fixes:**\n");
            hints.forEach(h -> sb.append("- ").append(h).append("\n"));
        }
        sb.append("\n");

        if (!failingGates.isEmpty()) {
            sb.append("## Quality Gate Findings\n\n");
            for (QualityGateResult gate : failingGates) {
                sb.append(QualityGateRemediation.fixText(gate)).append("\n");
            }
        }

        sb.append("## Validation Requirements\n\n");
        sb.append("The fixed work must pass the same validation again:\n");
        sb.append("1. **Core behaviour**: the requested functionality works\n");
        sb.append("2. **Error handling**: failure cases are handled\n");
        sb.append("3. **Performance**: performance targets are met\n");
        sb.append("4. **Security**: security conventions are respected\n");
        sb.append("5. **Test coverage**: the change is covered by tests\n\n");

        appendSuccessCriteria(sb, policy);
        appendOriginalTask(sb, context);
        return sb.toString();
    }

    /**
     * Instruction for the specialist taking over a loop. Carries the full failure history.
     */
    public static String escalationInstruction(FeedbackContext context, StagePolicy policy, String targetExecutor) {
        var sb = new StringBuilder();

        sb.append("## Escalated Work\n\n");
        sb.append("- **Previous executor:** ").append(context.executorId()).append("\n");
        sb.append("- **Escalated to:** ").append(targetExecutor).append("\n");
        sb.append("- **Reason:** still failing after ").append(context.retryCount()).append(" attempts\n");
        sb.append("- **Stage:** ").append(context.stage()).append("\n\n");

        sb.append("## Failure History\n\n");
        var history = context.failureHistory();
        for (int i = 0; i < history.size(); i++) {
            sb.append(i + 1).append(". ").append(history.get(i)).append("\n");
        }
        sb.append("\n");
        appendReportedFailures(sb, context);

        sb.append("## Expectations\n\n");
        sb.append("1. **Root cause**: analyse the problem from a different angle than the previous attempts\n");
        sb.append("2. **Design review**: check whether the failure comes from a design or architecture problem\n");
        sb.append("3. **Complete fix**: do not merely patch the symptom; make the result robust\n");
        sb.append("4. **Explain**: leave a short note in the code describing the fix\n\n");

        appendSuccessCriteria(sb, policy);
        appendOriginalTask(sb, context);
        return sb.toString();
    }

    /**
     * Instruction for the producing stage when a verifier blamed its artifact.
     */
    public static String rerouteInstruction(FeedbackContext verifier, ArtifactProducer producer,
                                            FailureRecord failure, FeedbackDecision remediation) {
        var sb = new StringBuilder();

        sb.append("## Defect Found During Verification\n\n");
        sb.append("- **Reported by stage:** ").append(verifier.stage())
          .append(" (").append(verifier.executorId()).append(")\n");
        sb.append("- **Returned to stage:** ").append(producer.stage())
          .append(" (").append(producer.executorId()).append(")\n");
        sb.append("- **Work order:** ").append(producer.workOrderId()).append("\n");
        sb.append("- **Finding:** ").append(failure.summary()).append("\n\n");

        if (remediation instanceof FeedbackDecision.Remediation r) {
            sb.append(r.instruction());
        } else {
            sb.append("No further remediation is possible: ").append(remediation.reasoning()).append("\n");
        }
        return sb.toString();
    }

    /**
     * Renders a RETRY or ESCALATE decision as an invocation entry someone can run by hand.
     * A ROLLBACK renders its nested remediation. Anything else renders as an empty string.
     */
    public static String renderDirective(FeedbackDecision decision) {
        if (decision instanceof FeedbackDecision.Rollback rollback) {
            return renderDirective(rollback.remediation());
        }
        if (!(decision instanceof FeedbackDecision.Remediation remediation)) {
            return "";
        }

        var sb = new StringBuilder();
        if (remediation instanceof FeedbackDecision.Escalate escalate) {
            sb.append("## Escalation Directive\n\n");
            sb.append("- **Escalate to:** ").append(escalate.targetExecutor()).append("\n");
            sb.append("- **Reason:** ").append(escalate.reasoning()).append("\n");
        } else {
            sb.append("## Retry Directive\n\n");
            sb.append("- **Target executor:** ").append(remediation.targetExecutor()).append("\n");
            sb.append("- **Task:** fix the work based on the validation failure\n");
        }
        sb.append("- **Confidence:** ").append(String.format(Locale.ROOT, "%.2f", remediation.confidence())).append("\n");
        sb.append("- **Estimated time:** ").append(remediation.estimatedRemediationTime().toSeconds()).append("s\n\n");

        sb.append(InstructionBatchWriter.invokeEntry(1, decision.loopId(), remediation.targetExecutor(),
                remediation.instruction()));

        sb.append("### Validation requirements\n\n");
        remediation.validationRequirements().forEach((k, v) ->
                sb.append("- ").append(k).append(": ").append(v).append("\n"));
        sb.append("\n### Success criteria\n\n");
        remediation.successCriteria().forEach((k, v) ->
                sb.append("- ").append(k).append(": ").append(v).append("\n"));
        sb.append("\n**Important:** run the same validation again once the executor has finished.\n");
        return sb.toString();
    }

    private static void appendReportedFailures(StringBuilder sb, FeedbackContext context) {
        if (context.validationResult() == null || context.validationResult().failures().isEmpty()) {
            return;
        }
        sb.append("### Reported failures\n\n");
        for (FailureRecord failure : context.validationResult().failures()) {
            sb.append("- ").append(failure.summary()).append("\n");
        }
        sb.append("\n");
    }

    private static void appendSuccessCriteria(StringBuilder sb, StagePolicy policy) {
        sb.append("## Success Criteria\n\n");
        policy.allSuccessCriteria().forEach((criterion, requirement) ->
                sb.append("- ").append(criterion).append(": ").append(requirement).append("\n"));
        sb.append("\n");
    }

    private static void appendOriginalTask(StringBuilder sb, FeedbackContext context) {
        sb.append("---\n\n");
        sb.append("## Original Task\n\n");
        sb.append(context.originalInstruction() == null ? "" : context.originalInstruction()).append("\n");
    }
}
