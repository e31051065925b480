package com.flowgraph.core.job;

import com.flowgraph.core.generator.ScopeKey;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one diagram job.
 *
 * @param scope scope of the job
 * @param status terminal status
 * @param artifact absolute path of the written DOT file, or null if none was written
 * @param image absolute path of the rendered image, or null if none was rendered
 * @param detail failure description, or null on success
 * @param elapsed wall-clock time spent on the job
 */
public record JobOutcome(
    ScopeKey scope,
    JobStatus status,
    Path artifact,
    Path image,
    String detail,
    Duration elapsed
) {
    /**
     * Compact constructor with validation.
     */
    public JobOutcome {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(status, "status must not be null");
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static JobOutcome succeeded(ScopeKey scope, Path artifact, Path image, Duration elapsed) {
        return new JobOutcome(scope, JobStatus.SUCCEEDED, artifact, image, null, elapsed);
    }

    public static JobOutcome skipped(ScopeKey scope, Duration elapsed) {
        return new JobOutcome(scope, JobStatus.SKIPPED_EMPTY, null, null, null, elapsed);
    }

    public static JobOutcome failed(ScopeKey scope, JobStatus status, Path artifact, String detail, Duration elapsed) {
        if (!status.isFailure()) {
            throw new IllegalArgumentException("Not a failure status: " + status);
        }
        return new JobOutcome(scope, status, artifact, null, detail, elapsed);
    }

    public static JobOutcome cancelled(ScopeKey scope) {
        return new JobOutcome(scope, JobStatus.CANCELLED, null, null, "batch cancelled", Duration.ZERO);
    }

    public boolean isFailure() {
        return status.isFailure();
    }
}
