package com.flowgraph.core.renderer;

/**
 * Result of one renderer invocation.
 *
 * @param exitCode process exit code; -1 if the process was killed after a timeout
 * @param timedOut true if the process did not finish within the timeout
 * @param output captured standard output and error, possibly truncated
 */
public record RenderResult(
    int exitCode,
    boolean timedOut,
    String output
) {
    /**
     * Compact constructor; a null output becomes empty.
     */
    public RenderResult {
        output = output == null ? "" : output;
    }

    public static RenderResult success(String output) {
        return new RenderResult(0, false, output);
    }

    public static RenderResult timeout(String output) {
        return new RenderResult(-1, true, output);
    }

    /**
     * Returns true if the renderer exited normally with code 0.
     *
     * @return true on success
     */
    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Describes a failed invocation for job reports.
     *
     * @param timeoutSeconds configured timeout, mentioned for timeouts
     * @return one-line description
     */
    public String describeFailure(long timeoutSeconds) {
        if (timedOut) {
            return "renderer timed out after " + timeoutSeconds + "s";
        }
        String firstLine = output.lines().filter(l -> !l.isBlank()).findFirst().orElse("");
        return firstLine.isEmpty()
            ? "renderer exited with code " + exitCode
            : "renderer exited with code " + exitCode + ": " + firstLine.strip();
    }
}
