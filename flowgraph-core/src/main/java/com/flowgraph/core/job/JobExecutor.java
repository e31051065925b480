package com.flowgraph.core.job;

/**
 * Executes a single job to a terminal outcome.
 *
 * <p>Implementations never throw: every failure is reported through the returned
 * {@link JobOutcome}. The dispatcher still guards against implementations that do.
 */
@FunctionalInterface
public interface JobExecutor {

    JobOutcome execute(DiagramJob job);
}
