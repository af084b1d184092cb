package com.pipewright.core.model;

/**
 * How the work orders of one stage are turned into an instruction batch.
 * <p>
 * PARALLEL: every instruction is produced independently on a bounded worker pool.
 * SEQUENTIAL: declared order, each step sees the previous step's result.
 * DEPENDENCY_GRAPH: topologically sorted, then run as a sequential pipeline.
 */
public enum DispatchMode {
    PARALLEL,
    SEQUENTIAL,
    DEPENDENCY_GRAPH
}
