package com.pipewright.core.model;

/**
 * Status reported by an external quality gate.
 */
public enum GateStatus {
    PASSED,
    WARNING,
    FAILED,
    BLOCKED;

    public boolean isFailing() {
        return this == FAILED || this == BLOCKED;
    }
}
