package com.flowgraph.cli;

import com.flowgraph.FlowGraphCLI;
import com.flowgraph.core.config.ConfigLoader;
import com.flowgraph.core.config.FlowGraphConfig;
import com.flowgraph.core.dispatch.BatchDispatcher;
import com.flowgraph.core.dispatch.BatchResult;
import com.flowgraph.core.dispatch.ExecutionMode;
import com.flowgraph.core.generator.DiagramGenerator;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.GeneratorRegistry;
import com.flowgraph.core.generator.ProcessLayout;
import com.flowgraph.core.job.DiagramJobRunner;
import com.flowgraph.core.job.JobPlan;
import com.flowgraph.core.job.JobPlanner;
import com.flowgraph.core.model.EnergySystem;
import com.flowgraph.core.output.ArtifactWriter;
import com.flowgraph.core.output.OutputDirectoryException;
import com.flowgraph.core.output.OutputDirectoryManager;
import com.flowgraph.core.output.OutputLayout;
import com.flowgraph.core.renderer.GraphvizRenderer;
import com.flowgraph.core.source.IndexedEnergySystem;
import com.flowgraph.core.source.ModelLoader;
import com.flowgraph.core.source.ModelValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to draw every diagram of one or more datasets.
 *
 * <p><b>Workflow:</b>
 * <ol>
 *   <li>Load configuration and apply command-line overrides</li>
 *   <li>Load and merge datasets, report validation warnings</li>
 *   <li>Select generators and plan one job per diagram</li>
 *   <li>Recreate the run directory {@code images_<dataset>}</li>
 *   <li>Write and render all diagrams on a bounded worker pool</li>
 *   <li>Print the summary</li>
 * </ol>
 *
 * <p>Exit codes: 0 when every diagram was drawn, 1 when the run could not start,
 * 2 when some diagrams failed.
 */
@Command(
    name = "generate",
    description = "Generate and render diagrams for energy system datasets",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SETUP_FAILED = 1;
    static final int EXIT_DEGRADED = 2;

    @Spec
    private CommandSpec spec;

    @ParentCommand
    private FlowGraphCLI parent;

    @Parameters(
        arity = "1..*",
        paramLabel = "DATASET",
        description = "Dataset files (YAML or JSON); several files are merged"
    )
    private List<Path> datasets;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME
    )
    private Path configFile;

    @Option(
        names = {"-o", "--output"},
        description = "Directory the run directory is created in (default: from config, or working directory)"
    )
    private Path outputDirectory;

    @Option(
        names = {"-f", "--format"},
        description = "Image format passed to the renderer, e.g. svg, png, pdf"
    )
    private String imageFormat;

    @Option(
        names = {"-j", "--jobs"},
        description = "Maximum number of diagrams rendered at once"
    )
    private Integer jobs;

    @Option(
        names = {"--sequential"},
        description = "Render diagrams one at a time on the calling thread"
    )
    private boolean sequential;

    @Option(
        names = {"--layout"},
        description = "Process diagram layout: ${COMPLETION-CANDIDATES}"
    )
    private ProcessLayout layout;

    @Option(
        names = {"--show-capacity"},
        description = "Label process diagrams with installed capacities"
    )
    private boolean showCapacity;

    @Option(
        names = {"--renderer"},
        description = "Renderer command (default: from config, or dot)"
    )
    private String rendererCommand;

    @Option(
        names = {"-g", "--generator"},
        split = ",",
        description = "Generator ids to run (default: all); see 'flowgraph list generators'"
    )
    private List<String> generatorIds;

    @Option(
        names = {"--dry-run"},
        description = "Write DOT files without rendering images"
    )
    private boolean dryRun;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            FlowGraphConfig config = ConfigLoader.load(configFile);
            DiagramSettings settings = resolveSettings(config);

            EnergySystem system = ModelLoader.load(datasets);
            for (String warning : ModelValidator.validate(system)) {
                log.warn("Dataset: {}", warning);
            }
            IndexedEnergySystem query = new IndexedEnergySystem(system);

            List<String> enabled = generatorIds != null ? generatorIds : config.generators().enabled();
            List<DiagramGenerator> generators = GeneratorRegistry.discover().select(enabled, settings);
            if (generators.isEmpty()) {
                err.println("✗ No generators selected");
                return EXIT_SETUP_FAILED;
            }

            JobPlan plan = new JobPlanner().plan(generators, query, settings);

            // Validate every setting before the previous run directory is deleted
            String command = rendererCommand != null ? rendererCommand : config.renderer().effectiveCommand();
            GraphvizRenderer renderer = new GraphvizRenderer(command, config.renderer().effectiveTimeout());
            BatchDispatcher dispatcher = new BatchDispatcher(
                jobs != null ? jobs : config.dispatch().effectiveConcurrency(),
                sequential ? ExecutionMode.SEQUENTIAL : config.dispatch().effectiveMode());

            Path parentDirectory = (outputDirectory != null ? outputDirectory : Paths.get(config.output().effectiveDirectory()))
                .toAbsolutePath().normalize();
            OutputLayout layout = new OutputDirectoryManager()
                .prepare(parentDirectory, OutputDirectoryManager.runName(datasets.get(0)));
            DiagramJobRunner runner = new DiagramJobRunner(query, settings, new ArtifactWriter(layout), renderer, dryRun);

            ConsoleReporter reporter = new ConsoleReporter(out, layout, System.console() != null, !isQuiet());
            BatchResult result = dispatcher.dispatch(plan.jobs(), runner, reporter);
            reporter.printSummary(result, plan.failedGenerators());

            if (result.isClean() && plan.failedGenerators().isEmpty()) {
                return EXIT_OK;
            }
            return EXIT_DEGRADED;

        } catch (IOException e) {
            log.error("Failed to load datasets", e);
            err.println("✗ " + e.getMessage());
            return EXIT_SETUP_FAILED;
        } catch (OutputDirectoryException e) {
            log.error("Failed to prepare output directory", e);
            err.println("✗ " + e.getMessage());
            return EXIT_SETUP_FAILED;
        } catch (IllegalArgumentException e) {
            log.error("Invalid setting: {}", e.getMessage());
            err.println("✗ " + e.getMessage());
            return EXIT_SETUP_FAILED;
        }
    }

    private DiagramSettings resolveSettings(FlowGraphConfig config) {
        DiagramSettings base = config.toDiagramSettings();
        return new DiagramSettings(
            imageFormat != null ? imageFormat.strip().toLowerCase() : base.imageFormat(),
            base.flowThreshold(),
            layout != null ? layout : base.processLayout(),
            showCapacity || base.showCapacity(),
            base.splines(),
            base.palette()
        );
    }

    private boolean isQuiet() {
        return parent != null && parent.isQuiet();
    }
}
