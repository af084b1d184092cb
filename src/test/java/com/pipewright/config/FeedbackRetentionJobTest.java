package com.pipewright.config;

import com.pipewright.core.feedback.FeedbackDecisionEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FeedbackRetentionJobTest {

    @Test
    @DisplayName("purges loops older than the configured max age")
    void purgesWithConfiguredAge() {
        var engine = mock(FeedbackDecisionEngine.class);
        when(engine.cleanupExpiredLoops(any(Duration.class))).thenReturn(2);
        var properties = new PipelineProperties();
        properties.getFeedback().getRetention().setMaxAge(Duration.ofHours(6));

        new FeedbackRetentionJob(engine, properties).purgeExpiredLoops();

        verify(engine).cleanupExpiredLoops(Duration.ofHours(6));
    }
}
