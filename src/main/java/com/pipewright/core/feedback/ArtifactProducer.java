package com.pipewright.core.feedback;

/**
 * The stage, executor and work order that produced an artifact a verifier checked.
 *
 * @param stage               producing stage name
 * @param executorId          executor that produced the artifact
 * @param workOrderId         producing work order
 * @param originalInstruction instruction the producer was originally given
 */
public record ArtifactProducer(String stage, String executorId, String workOrderId, String originalInstruction) {}
