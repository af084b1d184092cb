package com.pipewright.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable record of a closed feedback loop.
 *
 * @param context  the loop as it was when it was closed
 * @param outcome  why it was closed
 * @param closedAt when it was closed
 */
public record FeedbackHistoryEntry(
    FeedbackContext context,
    LoopOutcome outcome,
    Instant closedAt
) implements Serializable {

    public String loopId() {
        return context.loopId();
    }
}
