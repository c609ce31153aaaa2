package com.procurement.pipeline;

/**
 * Thrown when a run is triggered while another run still holds the run lock.
 */
public class PipelineAlreadyRunningException extends RuntimeException {

    public PipelineAlreadyRunningException() {
        super("a pipeline run is already in progress");
    }
}
