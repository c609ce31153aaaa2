package com.procurement.pipeline;

/**
 * A run failed before publishing. None of its derived tables were committed;
 * the previous run's tables remain visible.
 */
public class PipelineRunException extends RuntimeException {

    private final String runId;

    public PipelineRunException(String runId, Throwable cause) {
        super("pipeline run " + runId + " failed: " + cause.getMessage(), cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
