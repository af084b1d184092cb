package com.pipewright.core.metrics;

import com.pipewright.core.model.DispatchMode;
import com.pipewright.core.model.FeedbackAction;
import com.pipewright.core.model.LoopOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline scheduling and feedback loops.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatch(DispatchMode mode, long ms, int succeeded, int failed) {
        Timer.builder("pipewright.dispatch.duration")
                .tag("mode", mode.name().toLowerCase())
                .register(registry)
                .record(Duration.ofMillis(ms));

        Counter.builder("pipewright.workorders.total")
                .tag("outcome", "succeeded")
                .register(registry)
                .increment(succeeded);
        Counter.builder("pipewright.workorders.total")
                .tag("outcome", "failed")
                .register(registry)
                .increment(failed);
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("pipewright.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunResult(String status) {
        Counter.builder("pipewright.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    // --- Feedback loops ---

    public void recordDecision(String stage, FeedbackAction action) {
        Counter.builder("pipewright.feedback.decisions")
                .description("Decisions taken for validated attempts")
                .tag("stage", stage)
                .tag("action", action.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * Records how many attempts a loop had consumed when a decision was taken.
     */
    public void recordRetryDepth(int retryCount) {
        DistributionSummary.builder("pipewright.feedback.retry_depth")
                .register(registry)
                .record(retryCount);
    }

    public void recordLoopClosed(LoopOutcome outcome) {
        Counter.builder("pipewright.feedback.loops.closed")
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * Records a verification failure redirected to the stage that produced the artifact.
     *
     * @param fromStage the verifying stage
     * @param toStage   the producing stage that receives the remediation
     */
    public void recordReroute(String fromStage, String toStage) {
        Counter.builder("pipewright.feedback.reroutes")
                .description("Verification failures redirected to the producing stage")
                .tag("from", fromStage)
                .tag("to", toStage)
                .register(registry)
                .increment();
    }
}
