package com.flowgraph.core.job;

import com.flowgraph.core.StubGenerator;
import com.flowgraph.core.TestEnergySystems;
import com.flowgraph.core.generator.DiagramGenerator;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.generator.ScopeKey;
import com.flowgraph.core.generator.impl.CommodityGenerator;
import com.flowgraph.core.generator.impl.ProcessSeparateVintagesGenerator;
import com.flowgraph.core.generator.impl.SystemOverviewGenerator;
import com.flowgraph.core.output.ArtifactWriter;
import com.flowgraph.core.output.OutputDirectoryManager;
import com.flowgraph.core.output.OutputLayout;
import com.flowgraph.core.renderer.RenderResult;
import com.flowgraph.core.renderer.RendererInvoker;
import com.flowgraph.core.source.EnergySystemQuery;
import com.flowgraph.core.source.IndexedEnergySystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DiagramJobRunner}.
 */
class DiagramJobRunnerTest {

    @TempDir
    Path tempDir;

    private final EnergySystemQuery query = new IndexedEnergySystem(TestEnergySystems.solved());
    private final DiagramSettings settings = DiagramSettings.defaults();

    private OutputLayout layout;
    private RecordingRenderer renderer;

    @BeforeEach
    void setUp() {
        layout = new OutputDirectoryManager().prepare(tempDir, "images_test");
        renderer = new RecordingRenderer(RenderResult.success(""));
    }

    @Test
    void execute_success_writesArtifactAndRendersImage() throws IOException {
        DiagramJobRunner runner = runner(false);

        JobOutcome outcome = runner.execute(job(new SystemOverviewGenerator(), ScopeKey.whole(SystemOverviewGenerator.ID)));

        assertThat(outcome.status()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(outcome.artifact()).isEqualTo(layout.root().resolve("simple_model.dot"));
        assertThat(outcome.image()).isEqualTo(layout.root().resolve("simple_model.svg"));
        assertThat(Files.readString(outcome.artifact())).contains("strict digraph");
        assertThat(renderer.calls).containsExactly(List.of(outcome.artifact(), outcome.image(), "svg"));
        assertThat(outcome.detail()).isNull();
    }

    @Test
    void execute_dryRun_writesArtifactWithoutRendering() {
        DiagramJobRunner runner = runner(true);

        JobOutcome outcome = runner.execute(job(new CommodityGenerator(), ScopeKey.of(CommodityGenerator.ID, "commodity", "ELC")));

        assertThat(outcome.status()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(outcome.artifact()).isEqualTo(layout.root().resolve("commodities/commodity_ELC.dot")).exists();
        assertThat(outcome.image()).isNull();
        assertThat(renderer.calls).isEmpty();
    }

    @Test
    void execute_nothingToDraw_isSkippedWithoutFiles() throws IOException {
        DiagramJobRunner runner = runner(false);

        JobOutcome outcome = runner.execute(job(new ProcessSeparateVintagesGenerator(),
            ScopeKey.of(ProcessSeparateVintagesGenerator.ID, "tech", "IDLE")));

        assertThat(outcome.status()).isEqualTo(JobStatus.SKIPPED_EMPTY);
        assertThat(outcome.isFailure()).isFalse();
        try (Stream<Path> files = Files.list(layout.root().resolve("processes"))) {
            assertThat(files).isEmpty();
        }
        assertThat(renderer.calls).isEmpty();
    }

    @Test
    void execute_generatorThrows_reportsGenerationFailed() {
        StubGenerator failing = new StubGenerator("failing", 1) {
            @Override
            public Optional<GeneratedDiagram> generate(EnergySystemQuery q, ScopeKey scope, DiagramSettings s) {
                throw new IllegalStateException("boom");
            }
        };

        JobOutcome outcome = runner(false).execute(job(failing, ScopeKey.of("failing", "n", 0)));

        assertThat(outcome.status()).isEqualTo(JobStatus.GENERATION_FAILED);
        assertThat(outcome.detail()).isEqualTo("IllegalStateException: boom");
        assertThat(outcome.artifact()).isNull();
    }

    @Test
    void execute_artifactNotWritable_reportsWriteFailed() throws IOException {
        OutputLayout broken = new OutputLayout(tempDir.resolve("broken"));
        Files.createDirectories(broken.root());
        Files.writeString(broken.root().resolve("commodities"), "not a directory");
        DiagramJobRunner runner = new DiagramJobRunner(query, settings, new ArtifactWriter(broken), renderer, false);

        JobOutcome outcome = runner.execute(job(new CommodityGenerator(), ScopeKey.of(CommodityGenerator.ID, "commodity", "ELC")));

        assertThat(outcome.status()).isEqualTo(JobStatus.WRITE_FAILED);
        assertThat(outcome.detail()).isNotBlank();
        assertThat(renderer.calls).isEmpty();
    }

    @Test
    void execute_rendererExitsNonZero_keepsArtifactAndReportsFirstLine() {
        renderer = new RecordingRenderer(new RenderResult(1, false, "\nError: syntax error in line 3\nmore\n"));

        JobOutcome outcome = runner(false).execute(job(new SystemOverviewGenerator(), ScopeKey.whole(SystemOverviewGenerator.ID)));

        assertThat(outcome.status()).isEqualTo(JobStatus.RENDER_FAILED);
        assertThat(outcome.detail()).isEqualTo("renderer exited with code 1: Error: syntax error in line 3");
        assertThat(outcome.artifact()).exists();
        assertThat(outcome.image()).isNull();
    }

    @Test
    void execute_rendererTimesOut_reportsTimeout() {
        renderer = new RecordingRenderer(RenderResult.timeout(""));

        JobOutcome outcome = runner(false).execute(job(new SystemOverviewGenerator(), ScopeKey.whole(SystemOverviewGenerator.ID)));

        assertThat(outcome.status()).isEqualTo(JobStatus.RENDER_FAILED);
        assertThat(outcome.detail()).isEqualTo("renderer timed out after 7s");
    }

    @Test
    void execute_rendererCannotStart_reportsRenderFailed() {
        renderer = new RecordingRenderer(null);

        JobOutcome outcome = runner(false).execute(job(new SystemOverviewGenerator(), ScopeKey.whole(SystemOverviewGenerator.ID)));

        assertThat(outcome.status()).isEqualTo(JobStatus.RENDER_FAILED);
        assertThat(outcome.detail()).isEqualTo("IOException: Cannot run program \"dot\"");
    }

    @Test
    void execute_interruptedWhileRendering_isCancelledAndKeepsInterruptFlag() {
        RendererInvoker interrupted = new RecordingRenderer(RenderResult.success("")) {
            @Override
            public RenderResult render(Path artifact, Path image, String format) throws InterruptedException {
                throw new InterruptedException();
            }
        };
        DiagramJobRunner runner = new DiagramJobRunner(query, settings, new ArtifactWriter(layout), interrupted, false);

        JobOutcome outcome = runner.execute(job(new SystemOverviewGenerator(), ScopeKey.whole(SystemOverviewGenerator.ID)));

        assertThat(outcome.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(outcome.detail()).isEqualTo("interrupted while rendering");
        assertThat(Thread.interrupted()).isTrue();
    }

    private DiagramJobRunner runner(boolean dryRun) {
        return new DiagramJobRunner(query, settings, new ArtifactWriter(layout), renderer, dryRun);
    }

    private static DiagramJob job(DiagramGenerator generator, ScopeKey scope) {
        return new DiagramJob(generator, scope);
    }

    /**
     * Records invocations and answers with a fixed result; a null result simulates a missing command.
     */
    private static class RecordingRenderer implements RendererInvoker {

        final List<List<Object>> calls = new ArrayList<>();
        private final RenderResult result;

        RecordingRenderer(RenderResult result) {
            this.result = result;
        }

        @Override
        public RenderResult render(Path artifact, Path image, String format) throws IOException, InterruptedException {
            calls.add(List.of(artifact, image, format));
            if (result == null) {
                throw new IOException("Cannot run program \"dot\"");
            }
            return result;
        }

        @Override
        public long timeoutSeconds() {
            return 7;
        }
    }
}
