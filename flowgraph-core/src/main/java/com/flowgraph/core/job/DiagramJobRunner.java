package com.flowgraph.core.job;

import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.output.ArtifactWriter;
import com.flowgraph.core.renderer.RenderResult;
import com.flowgraph.core.renderer.RendererInvoker;
import com.flowgraph.core.source.EnergySystemQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one diagram job: generate, write the artifact, render the image.
 *
 * <p>Each stage maps its failures to a status of its own, and nothing escapes as an
 * exception, so one bad scope never affects the rest of the batch. The query and
 * settings are shared read-only between concurrent jobs; each job builds its own graph
 * sets and writes its own files.
 */
public class DiagramJobRunner implements JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(DiagramJobRunner.class);

    private final EnergySystemQuery query;
    private final DiagramSettings settings;
    private final ArtifactWriter writer;
    private final RendererInvoker renderer;
    private final boolean dryRun;

    /**
     * Creates a runner.
     *
     * @param query model queries
     * @param settings diagram settings
     * @param writer artifact writer for the run directory
     * @param renderer renderer invoker
     * @param dryRun if true, artifacts are written but not rendered
     */
    public DiagramJobRunner(EnergySystemQuery query, DiagramSettings settings, ArtifactWriter writer,
                            RendererInvoker renderer, boolean dryRun) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.dryRun = dryRun;
    }

    @Override
    public JobOutcome execute(DiagramJob job) {
        long start = System.nanoTime();

        Optional<GeneratedDiagram> generated;
        try {
            generated = job.generator().generate(query, job.scope(), settings);
        } catch (RuntimeException e) {
            log.error("Generation failed for {}", job.scope(), e);
            return JobOutcome.failed(job.scope(), JobStatus.GENERATION_FAILED, null, describe(e), since(start));
        }
        if (generated.isEmpty()) {
            return JobOutcome.skipped(job.scope(), since(start));
        }
        GeneratedDiagram diagram = generated.get();

        Path artifact;
        try {
            artifact = writer.write(diagram);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write artifact {} for {}", diagram.artifactPath(), job.scope(), e);
            return JobOutcome.failed(job.scope(), JobStatus.WRITE_FAILED, null, describe(e), since(start));
        }

        if (dryRun) {
            log.debug("Dry run, not rendering {}", artifact);
            return JobOutcome.succeeded(job.scope(), artifact, null, since(start));
        }

        Path image = writer.imagePath(diagram, settings.imageFormat());
        try {
            RenderResult result = renderer.render(artifact, image, settings.imageFormat());
            if (!result.succeeded()) {
                String detail = result.describeFailure(renderer.timeoutSeconds());
                log.warn("Rendering {} failed: {}", diagram.artifactPath(), detail);
                return JobOutcome.failed(job.scope(), JobStatus.RENDER_FAILED, artifact, detail, since(start));
            }
        } catch (IOException e) {
            log.error("Could not start renderer for {}", diagram.artifactPath(), e);
            return JobOutcome.failed(job.scope(), JobStatus.RENDER_FAILED, artifact, describe(e), since(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new JobOutcome(job.scope(), JobStatus.CANCELLED, artifact, null, "interrupted while rendering", since(start));
        }

        log.debug("Rendered {} in {} ms", image, since(start).toMillis());
        return JobOutcome.succeeded(job.scope(), artifact, image, since(start));
    }

    private static Duration since(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
