package com.papertrail.core.pipeline;

import com.papertrail.core.PaperTrailException;

/**
 * A pipeline stage failed. Stages committed before it stay committed; the
 * failed stage left no rows in the graph store.
 */
public class StageFailedException extends PaperTrailException {

    private final PipelineStage stage;
    private final String runId;

    public StageFailedException(PipelineStage stage, String runId, Throwable cause) {
        super("Stage " + stage + " failed for run " + runId + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.runId = runId;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public String getRunId() {
        return runId;
    }
}
