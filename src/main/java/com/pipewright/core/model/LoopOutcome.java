package com.pipewright.core.model;

/**
 * How a feedback loop left the active set.
 */
public enum LoopOutcome {
    SUCCEEDED,
    ESCALATED,
    ABORTED,
    EXPIRED
}
