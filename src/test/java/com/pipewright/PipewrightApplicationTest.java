package com.pipewright;

import com.pipewright.config.FeedbackRetentionJob;
import com.pipewright.config.PipelineProperties;
import com.pipewright.core.feedback.FeedbackDecisionEngine;
import com.pipewright.core.model.DispatchMode;
import com.pipewright.core.model.ValidationResult;
import com.pipewright.core.model.WorkOrder;
import com.pipewright.core.orchestrator.PipelineRequest;
import com.pipewright.core.orchestrator.StageDefinition;
import com.pipewright.core.orchestrator.StageOrchestrator;
import com.pipewright.core.state.FeedbackStore;
import com.pipewright.core.state.JsonFileFeedbackStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "pipewright.stages.deploy.max-attempts=2",
        "pipewright.stages.deploy.default-escalation-executor=sre",
        "pipewright.orchestrator.max-stage-entries=4"
})
class PipewrightApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private PipelineProperties properties;

    @Autowired
    private FeedbackDecisionEngine engine;

    @Autowired
    private FeedbackStore store;

    @Autowired
    private StageOrchestrator orchestrator;

    @Test
    @DisplayName("binds pipewright properties")
    void bindsProperties() {
        assertEquals(10, properties.getScheduler().getMaxWorkers());
        assertEquals(4, properties.getOrchestrator().getMaxStageEntries());
        assertEquals(2, properties.getStages().get("deploy").getMaxAttempts());
    }

    @Test
    @DisplayName("configured stages get a feedback policy")
    void configuredStagePolicy() {
        assertTrue(engine.hasPolicy("deploy"));
        assertTrue(engine.hasPolicy("testing"));
    }

    @Test
    @DisplayName("uses the in-memory store and no retention job when both are switched off")
    void storeAndRetention() {
        assertFalse(store instanceof JsonFileFeedbackStore);
        assertTrue(context.getBeansOfType(FeedbackRetentionJob.class).isEmpty());
    }

    @Test
    @DisplayName("the wired orchestrator runs a pipeline end to end")
    void runsPipeline() {
        var stages = List.of(StageDefinition.production("deploy", DispatchMode.SEQUENTIAL, List.of(
                WorkOrder.pending("d-1", "sre", "Roll out", "Deploy build 42"))));

        var result = orchestrator.execute(PipelineRequest.of(stages, (stage, run) -> ValidationResult.passed()));

        assertTrue(result.succeeded());
        assertEquals(1, result.feedback().closedLoops());
    }
}
