package com.flowgraph.cli;

import com.flowgraph.core.dispatch.BatchResult;
import com.flowgraph.core.dispatch.BatchState;
import com.flowgraph.core.dispatch.DispatchListener;
import com.flowgraph.core.job.DiagramJob;
import com.flowgraph.core.job.JobOutcome;
import com.flowgraph.core.job.JobStatus;
import com.flowgraph.core.output.OutputLayout;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Prints batch progress to the console, one line per finished job, with optional ANSI
 * colour.
 *
 * <pre>
 * ✓ commodities/commodity_ELC.svg
 * – process-separate-vintages[tech=IMPHYD] (nothing to draw)
 * ✗ tech-results[tech=E01, period=2000] RENDER_FAILED: renderer exited with code 1
 * </pre>
 *
 * <p>Job events arrive on worker threads; printing is synchronized so lines never
 * interleave.
 */
public class ConsoleReporter implements DispatchListener {

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    static final String SUCCESS_MARK = "✓";
    static final String FAILURE_MARK = "✗";
    static final String SKIPPED_MARK = "–";

    private final PrintWriter out;
    private final OutputLayout layout;
    private final boolean useColors;
    private final boolean showJobs;

    /**
     * Creates a reporter.
     *
     * @param out console writer
     * @param layout run directory, used to print relative paths
     * @param useColors whether to use ANSI colors
     * @param showJobs whether to print a line per job; failures are always printed
     */
    public ConsoleReporter(PrintWriter out, OutputLayout layout, boolean useColors, boolean showJobs) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.useColors = useColors;
        this.showJobs = showJobs;
    }

    @Override
    public synchronized void batchStateChanged(BatchState state, int jobCount) {
        if (state == BatchState.STARTED && showJobs) {
            out.println(color(ANSI_BOLD) + "Drawing " + jobCount + " diagrams into " + layout.root() + reset());
            out.flush();
        }
    }

    @Override
    public synchronized void jobFinished(DiagramJob job, JobOutcome outcome) {
        if (!showJobs && !outcome.isFailure()) {
            return;
        }
        out.println(formatOutcome(outcome));
        out.flush();
    }

    /**
     * Prints the batch summary.
     *
     * @param result batch result
     * @param failedGenerators generators whose scopes could not be listed
     */
    public synchronized void printSummary(BatchResult result, List<String> failedGenerators) {
        long succeeded = result.count(JobStatus.SUCCEEDED);
        long skipped = result.count(JobStatus.SKIPPED_EMPTY);
        long failed = result.failures().size();

        out.println();
        out.printf("%s%d diagrams: %d succeeded, %d skipped, %d failed (%d ms)%s%n",
            color(ANSI_BOLD), result.total(), succeeded, skipped, failed, result.elapsed().toMillis(), reset());

        for (String generator : failedGenerators) {
            out.println(color(ANSI_RED) + FAILURE_MARK + " generator " + generator + " could not list its diagrams" + reset());
        }

        if (result.cancelled()) {
            out.println(color(ANSI_YELLOW) + "⚠ Batch cancelled before all jobs finished" + reset());
        } else if (failed > 0 || !failedGenerators.isEmpty()) {
            out.println(color(ANSI_YELLOW) + "⚠ Batch degraded: " + failed + " job(s) failed" + reset());
        } else {
            out.println(color(ANSI_GREEN) + SUCCESS_MARK + " Diagrams written to " + layout.root() + reset());
        }
        out.flush();
    }

    String formatOutcome(JobOutcome outcome) {
        return switch (outcome.status()) {
            case SUCCEEDED -> color(ANSI_GREEN) + SUCCESS_MARK + reset() + " " + describeFiles(outcome);
            case SKIPPED_EMPTY -> color(ANSI_YELLOW) + SKIPPED_MARK + reset() + " " + outcome.scope() + " (nothing to draw)";
            default -> color(ANSI_RED) + FAILURE_MARK + reset() + " " + outcome.scope() + " " + outcome.status()
                + (outcome.detail() == null ? "" : ": " + outcome.detail());
        };
    }

    private String describeFiles(JobOutcome outcome) {
        Path file = outcome.image() != null ? outcome.image() : outcome.artifact();
        if (file == null) {
            return outcome.scope().toString();
        }
        return file.startsWith(layout.root()) ? layout.root().relativize(file).toString().replace('\\', '/') : file.toString();
    }

    private String color(String code) {
        return useColors ? code : "";
    }

    private String reset() {
        return useColors ? ANSI_RESET : "";
    }
}
