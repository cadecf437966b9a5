package com.papertrail.core.pipeline;

/**
 * Stages of one analysis run, in execution order.
 */
public enum PipelineStage {
    /** Cluster raw records into canonical entities. */
    RESOLVE,
    /** Commit canonical nodes to the graph store. */
    MATERIALIZE,
    /** Compute derived edges and commit them. */
    DERIVE,
    /** Compute analytics and red flags and commit them. */
    DETECT
}
