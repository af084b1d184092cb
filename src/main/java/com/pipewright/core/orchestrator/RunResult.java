package com.pipewright.core.orchestrator;

import com.pipewright.core.events.PipelineEvent;
import com.pipewright.core.feedback.FeedbackStatus;
import com.pipewright.core.model.RunStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of an orchestrated run.
 *
 * @param runId                      run id
 * @param status                     COMPLETED only when every stage completed
 * @param stages                     per-stage results in execution order
 * @param failedStages               names of the stages that ended FAILED
 * @param remediationInstructions    rendered remediation for every unresolved loop and the
 *                                   reasoning of every abort
 * @param requiresManualIntervention true when the run failed
 * @param feedback                   feedback summary of the run
 * @param feedbackEvents             the run's {@code feedback.*} events in publish order
 * @param elapsedMs                  wall-clock duration
 */
public record RunResult(
    String runId,
    RunStatus status,
    Map<String, StageResult> stages,
    List<String> failedStages,
    List<String> remediationInstructions,
    boolean requiresManualIntervention,
    FeedbackStatus feedback,
    List<PipelineEvent> feedbackEvents,
    long elapsedMs
) {

    public RunResult {
        stages = stages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stages));
        failedStages = failedStages == null ? List.of() : List.copyOf(failedStages);
        remediationInstructions = remediationInstructions == null ? List.of() : List.copyOf(remediationInstructions);
        feedbackEvents = feedbackEvents == null ? List.of() : List.copyOf(feedbackEvents);
    }

    public StageResult stage(String name) {
        return stages.get(name);
    }

    public StageStatus stageStatus(String name) {
        StageResult result = stages.get(name);
        return result != null ? result.status() : null;
    }

    public List<PipelineEvent> feedbackEvents(String eventType) {
        return feedbackEvents.stream().filter(e -> e.eventType().equals(eventType)).toList();
    }

    public boolean succeeded() {
        return status == RunStatus.COMPLETED;
    }
}
