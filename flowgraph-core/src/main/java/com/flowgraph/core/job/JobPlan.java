package com.flowgraph.core.job;

import java.util.List;

/**
 * Jobs expanded from the selected generators.
 *
 * @param jobs jobs in generator order, then scope order
 * @param failedGenerators ids of generators whose scopes could not be listed
 */
public record JobPlan(
    List<DiagramJob> jobs,
    List<String> failedGenerators
) {
    /**
     * Compact constructor; copies both lists.
     */
    public JobPlan {
        jobs = List.copyOf(jobs);
        failedGenerators = List.copyOf(failedGenerators);
    }
}
