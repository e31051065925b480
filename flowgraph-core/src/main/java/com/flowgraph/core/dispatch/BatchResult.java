package com.flowgraph.core.dispatch;

import com.flowgraph.core.job.JobOutcome;
import com.flowgraph.core.job.JobStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of a batch, one per submitted job, in submission order.
 *
 * @param outcomes job outcomes
 * @param elapsed wall-clock time of the batch
 * @param cancelled true if the batch was interrupted before all jobs finished
 */
public record BatchResult(
    List<JobOutcome> outcomes,
    Duration elapsed,
    boolean cancelled
) {
    /**
     * Compact constructor; copies the outcomes.
     */
    public BatchResult {
        outcomes = List.copyOf(outcomes);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public int total() {
        return outcomes.size();
    }

    public long count(JobStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    /**
     * Returns the number of outcomes per status; statuses without outcomes are omitted.
     *
     * @return counts by status, in declaration order
     */
    public Map<JobStatus, Long> counts() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobOutcome outcome : outcomes) {
            counts.merge(outcome.status(), 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    public List<JobOutcome> failures() {
        return outcomes.stream().filter(JobOutcome::isFailure).toList();
    }

    /**
     * Returns true if every job succeeded or was skipped.
     *
     * @return true for a clean batch
     */
    public boolean isClean() {
        return !cancelled && outcomes.stream().noneMatch(JobOutcome::isFailure);
    }
}
