package com.flowgraph.core.dispatch;

/**
 * How a batch runs its jobs.
 */
public enum ExecutionMode {
    /** On a fixed pool of worker threads */
    PARALLEL,

    /** One after another on the calling thread */
    SEQUENTIAL
}
