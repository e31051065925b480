package com.flowgraph.core.dispatch;

/**
 * Lifecycle of a batch: {@code STARTED -> RUNNING -> COMPLETE}.
 */
public enum BatchState {
    STARTED,
    RUNNING,
    COMPLETE
}
