package com.pipewright.core.orchestrator;

/**
 * Lifecycle of a stage within one run. SUSPENDED means the stage waits while a failure it
 * reported is fixed by another stage.
 */
public enum StageStatus {
    PENDING,
    RUNNING,
    SUSPENDED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
