package com.pipewright.core.orchestrator;

import java.util.List;

/**
 * A pipeline to execute.
 *
 * @param runId     run id to use; generated when null
 * @param stages    stage definitions, in any order
 * @param validator source of validation results for dispatched stages
 */
public record PipelineRequest(String runId, List<StageDefinition> stages, StageValidator validator) {

    public PipelineRequest {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public static PipelineRequest of(List<StageDefinition> stages, StageValidator validator) {
        return new PipelineRequest(null, stages, validator);
    }
}
