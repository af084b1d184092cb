package com.pipewright.core.model;

/**
 * Severity of a validation failure, ordered from least to most severe.
 */
public enum FeedbackSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean atLeast(FeedbackSeverity other) {
        return compareTo(other) >= 0;
    }
}
