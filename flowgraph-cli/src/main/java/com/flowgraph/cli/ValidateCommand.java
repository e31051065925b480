package com.flowgraph.cli;

import com.flowgraph.core.config.ConfigLoader;
import com.flowgraph.core.config.FlowGraphConfig;
import com.flowgraph.core.model.EnergySystem;
import com.flowgraph.core.source.ModelLoader;
import com.flowgraph.core.source.ModelValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate the configuration file and, optionally, datasets.
 *
 * <p>Unlike {@code generate}, an unparsable configuration is an error here. Dataset
 * findings are reported as warnings and do not fail validation.
 */
@Command(
    name = "validate",
    description = "Validate configuration file and datasets",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME
    )
    private Path configFile;

    @Parameters(
        arity = "0..*",
        paramLabel = "DATASET",
        description = "Dataset files to check"
    )
    private List<Path> datasets = List.of();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        boolean valid = true;

        if (Files.exists(configFile)) {
            log.info("Validating configuration: {}", configFile);
            try {
                FlowGraphConfig config = ConfigLoader.loadStrict(configFile);
                config.toDiagramSettings();
                out.println("✓ Configuration " + configFile);
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Invalid configuration {}", configFile, e);
                out.println("✗ Configuration " + configFile + ": " + e.getMessage());
                valid = false;
            }
        } else {
            out.println("– No configuration file " + configFile + ", defaults apply");
        }

        for (Path dataset : datasets) {
            try {
                EnergySystem system = ModelLoader.load(dataset);
                List<String> warnings = ModelValidator.validate(system);
                out.println("✓ Dataset " + dataset + " (" + warnings.size() + " warnings)");
                for (String warning : warnings) {
                    out.println("    ⚠ " + warning);
                }
            } catch (IOException e) {
                log.debug("Invalid dataset {}", dataset, e);
                out.println("✗ Dataset " + dataset + ": " + e.getMessage());
                valid = false;
            }
        }

        out.flush();
        return valid ? 0 : 1;
    }
}
