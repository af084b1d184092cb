package com.pipewright.config;

import com.pipewright.core.feedback.FeedbackDecisionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically archives feedback loops that stayed open longer than
 * {@code pipewright.feedback.retention.max-age}.
 */
@Component
@ConditionalOnProperty(prefix = "pipewright.feedback.retention", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class FeedbackRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(FeedbackRetentionJob.class);

    private final FeedbackDecisionEngine engine;
    private final PipelineProperties properties;

    public FeedbackRetentionJob(FeedbackDecisionEngine engine, PipelineProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${pipewright.feedback.retention.interval:PT1H}",
               initialDelayString = "${pipewright.feedback.retention.interval:PT1H}")
    public void purgeExpiredLoops() {
        var maxAge = properties.getFeedback().getRetention().getMaxAge();
        int removed = engine.cleanupExpiredLoops(maxAge);
        if (removed > 0) {
            log.info("Retention: archived {} feedback loops older than {}", removed, maxAge);
        } else {
            log.debug("Retention: no feedback loops older than {}", maxAge);
        }
    }
}
