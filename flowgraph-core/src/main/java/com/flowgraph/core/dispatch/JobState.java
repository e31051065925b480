package com.flowgraph.core.dispatch;

/**
 * Lifecycle of a job within a batch: {@code PENDING -> RUNNING -> SUCCEEDED | FAILED}.
 *
 * <p>Skipped jobs count as succeeded; cancelled jobs as failed. A job cancelled before it
 * started goes straight from {@code PENDING} to {@code FAILED}.
 */
public enum JobState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED
}
