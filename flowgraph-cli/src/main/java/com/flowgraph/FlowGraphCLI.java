package com.flowgraph;

import ch.qos.logback.classic.Level;
import com.flowgraph.cli.GenerateCommand;
import com.flowgraph.cli.ListCommand;
import com.flowgraph.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for flowgraph.
 *
 * <p>flowgraph draws Graphviz diagrams of an energy system model and its solved results:
 * the whole network, one diagram per carrier and technology, and result diagrams per
 * period, technology, process and carrier.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate and render all diagrams for one or more datasets</li>
 *   <li>{@code list} - List available diagram generators</li>
 *   <li>{@code validate} - Validate configuration and datasets</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Draw every diagram of a solved model as svg
 * flowgraph generate utopia.yaml
 *
 * # Png images, four workers, verbose logging
 * flowgraph -v generate -f png -j 4 utopia.yaml
 *
 * # List available generators
 * flowgraph list generators
 * }</pre>
 */
@Command(
    name = "flowgraph",
    mixinStandardHelpOptions = true,
    version = "flowgraph 1.0.0-SNAPSHOT",
    description = "Graphviz diagrams of energy system models and their results",
    subcommands = {
        GenerateCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class FlowGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FlowGraphCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        spec.commandLine().getOut().println("flowgraph - Graphviz diagrams of energy system models");
        spec.commandLine().getOut().println("Version: 1.0.0-SNAPSHOT");
        spec.commandLine().getOut().println();
        spec.commandLine().getOut().println("Use 'flowgraph --help' to see available commands");
        spec.commandLine().getOut().println("Use 'flowgraph <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        Logger logger = LoggerFactory.getLogger("com.flowgraph");
        if (!(logger instanceof ch.qos.logback.classic.Logger)) {
            log.debug("Logging backend is not logback, leaving levels unchanged");
            return;
        }
        ch.qos.logback.classic.Logger appLogger = (ch.qos.logback.classic.Logger) logger;

        if (quiet) {
            appLogger.setLevel(Level.ERROR);
        } else if (verbose) {
            appLogger.setLevel(Level.DEBUG);
        } else {
            appLogger.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        FlowGraphCLI cli = new FlowGraphCLI();
        CommandLine commandLine = new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
