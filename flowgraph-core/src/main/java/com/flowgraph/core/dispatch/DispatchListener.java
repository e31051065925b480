package com.flowgraph.core.dispatch;

import com.flowgraph.core.job.DiagramJob;
import com.flowgraph.core.job.JobOutcome;

/**
 * Receives progress events from a {@link BatchDispatcher}.
 *
 * <p>Job events are delivered on worker threads, possibly concurrently; implementations
 * must be thread-safe. Exceptions thrown by a listener are logged and ignored.
 */
public interface DispatchListener {

    /** Listener that ignores all events */
    DispatchListener NONE = new DispatchListener() {
    };

    default void batchStateChanged(BatchState state, int jobCount) {
    }

    default void jobStateChanged(DiagramJob job, JobState state) {
    }

    /**
     * Called once per job with its terminal outcome, after the final state change.
     *
     * @param job finished job
     * @param outcome outcome of the job
     */
    default void jobFinished(DiagramJob job, JobOutcome outcome) {
    }
}
