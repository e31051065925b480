package com.flowgraph.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CliTestSupport {

    @TempDir
    Path tempDir;

    @Test
    void validate_noConfigFile_reportsDefaults() {
        Path config = tempDir.resolve("flowgraph.yaml");

        int exitCode = run("validate", "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("– No configuration file " + config + ", defaults apply");
    }

    @Test
    void validate_validConfigAndDataset_reportsWarnings() throws IOException {
        Path config = Files.writeString(tempDir.resolve("flowgraph.yaml"),
            "output:\n  imageFormat: png\ndispatch:\n  concurrency: 2\n  mode: sequential\n");
        Path dataset = copyFixture("utopia.yaml", tempDir);

        int exitCode = run("validate", "-c", config.toString(), dataset.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("✓ Configuration " + config)
            .contains("✓ Dataset " + dataset + " (1 warnings)")
            .contains("⚠ Technology is declared but never used: IDLE");
    }

    @Test
    void validate_invalidImageFormat_fails() throws IOException {
        Path config = Files.writeString(tempDir.resolve("flowgraph.yaml"), "output:\n  imageFormat: \"svg; rm -rf\"\n");

        int exitCode = run("validate", "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("✗ Configuration " + config + ": Invalid image format");
    }

    @Test
    void validate_malformedConfig_fails() throws IOException {
        Path config = Files.writeString(tempDir.resolve("flowgraph.yaml"), "output: [unclosed\n");

        int exitCode = run("validate", "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("✗ Configuration " + config);
    }

    @Test
    void validate_missingDataset_fails() {
        Path dataset = tempDir.resolve("missing.yaml");

        int exitCode = run("validate", "-c", tempDir.resolve("absent.yaml").toString(), dataset.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("✗ Dataset " + dataset + ": Dataset file not found");
    }
}
