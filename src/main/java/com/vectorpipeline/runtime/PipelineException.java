package com.vectorpipeline.runtime;

/**
 * Top-level failure of a batch operation. The stage names where it failed; the cause is the
 * collaborator's original exception.
 */
public class PipelineException extends RuntimeException {
    private final PipelineStage stage;

    public PipelineException(PipelineStage stage, Throwable cause) {
        super(stage + " failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public PipelineStage stage() {
        return stage;
    }
}
