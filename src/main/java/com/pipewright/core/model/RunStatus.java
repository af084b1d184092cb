package com.pipewright.core.model;

/**
 * Aggregate status of a {@link PipelineRun} or of a whole orchestrated run.
 */
public enum RunStatus {
    COMPLETED,
    FAILED
}
