package com.pipewright.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a pipeline run is scheduled, validated and remediated.
 *
 * @param eventType event type (e.g. "run.started", "stage.completed", "feedback.escalated")
 * @param runId     the run this event belongs to
 * @param subjectId stage name, work order id or loop id the event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
