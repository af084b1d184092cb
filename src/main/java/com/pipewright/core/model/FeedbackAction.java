package com.pipewright.core.model;

/**
 * What the orchestrator should do about a validated attempt.
 */
public enum FeedbackAction {
    RETRY,
    ESCALATE,
    ABORT,
    CONTINUE,
    ROLLBACK
}
