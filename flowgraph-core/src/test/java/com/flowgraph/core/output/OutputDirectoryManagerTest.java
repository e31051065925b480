package com.flowgraph.core.output;

import com.flowgraph.core.generator.DiagramCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link OutputDirectoryManager}.
 */
class OutputDirectoryManagerTest {

    @TempDir
    Path tempDir;

    private final OutputDirectoryManager manager = new OutputDirectoryManager();

    @Test
    void runName_usesDatasetBaseName() {
        assertThat(OutputDirectoryManager.runName(Paths.get("data/utopia.yaml"))).isEqualTo("images_utopia");
    }

    @Test
    void prepare_createsCategoryDirectories() {
        OutputLayout layout = manager.prepare(tempDir, "images_utopia");

        assertThat(layout.root()).isEqualTo(tempDir.resolve("images_utopia"));
        assertThat(layout.categoryDirectory(DiagramCategory.COMMODITIES)).isDirectory();
        assertThat(layout.categoryDirectory(DiagramCategory.PROCESSES)).isDirectory();
        assertThat(layout.categoryDirectory(DiagramCategory.RESULTS)).isDirectory();
        assertThat(layout.categoryDirectory(DiagramCategory.SYSTEM)).isEqualTo(layout.root());
    }

    @Test
    void prepare_existingRun_removesStaleFiles() throws IOException {
        OutputLayout first = manager.prepare(tempDir, "images_utopia");
        Path stale = first.root().resolve("results/results_OLD_1990.svg");
        Files.writeString(stale, "<svg/>");
        Path strayDirectory = first.root().resolve("stray/nested");
        Files.createDirectories(strayDirectory);

        OutputLayout second = manager.prepare(tempDir, "images_utopia");

        assertThat(stale).doesNotExist();
        assertThat(strayDirectory.getParent()).doesNotExist();
        assertThat(second.categoryDirectory(DiagramCategory.RESULTS)).isEmptyDirectory();
    }

    @Test
    void prepare_missingParent_isCreated() {
        OutputLayout layout = manager.prepare(tempDir.resolve("a/b"), "images_x");

        assertThat(layout.root()).isDirectory();
    }

    @Test
    void prepare_relativeParent_throwsException() {
        assertThatThrownBy(() -> manager.prepare(Paths.get("relative"), "images_x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void prepare_runNameWithSeparator_throwsException() {
        assertThatThrownBy(() -> manager.prepare(tempDir, "../escape"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.prepare(tempDir, ".."))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void prepare_parentIsFile_throwsOutputDirectoryException() throws IOException {
        Path file = Files.writeString(tempDir.resolve("file"), "x");

        assertThatThrownBy(() -> manager.prepare(file, "images_x"))
            .isInstanceOf(OutputDirectoryException.class)
            .hasCauseInstanceOf(IOException.class);
    }
}
