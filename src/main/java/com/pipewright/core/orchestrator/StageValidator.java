package com.pipewright.core.orchestrator;

import com.pipewright.core.model.PipelineRun;
import com.pipewright.core.model.ValidationResult;

/**
 * Supplies the validation result executors reported for a dispatched stage.
 * Failures may be scoped to a work order through {@code FailureRecord.workOrderId}.
 */
@FunctionalInterface
public interface StageValidator {

    ValidationResult validate(StageDefinition stage, PipelineRun run);
}
