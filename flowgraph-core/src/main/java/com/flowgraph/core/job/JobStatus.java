package com.flowgraph.core.job;

/**
 * Terminal status of a diagram job.
 */
public enum JobStatus {
    /** Artifact written and rendered (or written, in a dry run) */
    SUCCEEDED(false),

    /** The scope had nothing to draw; no file was written */
    SKIPPED_EMPTY(false),

    /** The artifact could not be written */
    WRITE_FAILED(true),

    /** The renderer exited with an error, timed out or could not be started */
    RENDER_FAILED(true),

    /** The generator threw while drawing the scope */
    GENERATION_FAILED(true),

    /** The batch was cancelled before the job finished */
    CANCELLED(true);

    private final boolean failure;

    JobStatus(boolean failure) {
        this.failure = failure;
    }

    public boolean isFailure() {
        return failure;
    }
}
