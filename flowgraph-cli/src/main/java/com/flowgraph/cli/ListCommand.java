package com.flowgraph.cli;

import com.flowgraph.core.generator.DiagramGenerator;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.GeneratorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the available diagram generators.
 *
 * <p>Discovers generators via Java Service Provider Interface (SPI) and displays their
 * ids, output directories and whether they run with the default settings.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * flowgraph list generators
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available diagram generators",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: generators"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "generators", "generator" -> listGenerators();
            default -> {
                log.error("Unknown type: {}. Use: generators", type);
                spec.commandLine().getErr().println("Unknown type: " + type + ". Use: generators");
                yield 1;
            }
        };
    }

    private int listGenerators() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Generators:");
        out.println();

        List<DiagramGenerator> generators = GeneratorRegistry.discover().all();
        DiagramSettings defaults = DiagramSettings.defaults();

        for (DiagramGenerator generator : generators) {
            String directory = generator.getCategory().directoryName();
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    Output: %s%n", directory.isEmpty() ? "run directory" : directory + "/");
            if (!generator.appliesTo(defaults)) {
                out.println("    Not active with default settings");
            }
            out.println();
        }

        if (generators.isEmpty()) {
            out.println("  No generators found.");
        }
        out.flush();
        return 0;
    }
}
