package com.flowgraph.core.output;

import com.flowgraph.core.generator.GeneratedDiagram;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ArtifactWriter} and {@link OutputLayout}.
 */
class ArtifactWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_storesDotFileBelowRoot() throws IOException {
        ArtifactWriter writer = new ArtifactWriter(new OutputLayout(tempDir));
        GeneratedDiagram diagram = new GeneratedDiagram("commodities/commodity_ELC", "strict digraph x {\n}\n");

        Path artifact = writer.write(diagram);

        assertThat(artifact).isEqualTo(tempDir.resolve("commodities/commodity_ELC.dot"));
        assertThat(Files.readString(artifact)).isEqualTo("strict digraph x {\n}\n");
        assertThat(writer.imagePath(diagram, "svg")).isEqualTo(tempDir.resolve("commodities/commodity_ELC.svg"));
        assertThat(writer.layout().root()).isEqualTo(tempDir);
    }

    @Test
    void write_overwritesExistingArtifact() throws IOException {
        ArtifactWriter writer = new ArtifactWriter(new OutputLayout(tempDir));
        writer.write(new GeneratedDiagram("simple_model", "old"));

        Path artifact = writer.write(new GeneratedDiagram("simple_model", "new"));

        assertThat(Files.readString(artifact)).isEqualTo("new");
    }

    @Test
    void layout_relativeRoot_throwsException() {
        assertThatThrownBy(() -> new OutputLayout(Paths.get("relative")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void layout_resolveOutsideRoot_throwsException() {
        OutputLayout layout = new OutputLayout(tempDir);

        assertThatThrownBy(() -> layout.resolve("a/../../outside.dot"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("escapes");
    }
}
