package com.flowgraph.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void getExtension_withExtension_returnsExtension() {
        assertThat(FileUtils.getExtension(Paths.get("data/utopia.yaml"))).isEqualTo("yaml");
        assertThat(FileUtils.getExtension(Paths.get("archive.tar.gz"))).isEqualTo("gz");
    }

    @Test
    void getExtension_withoutExtension_returnsEmptyString() {
        assertThat(FileUtils.getExtension(Paths.get("Makefile"))).isEmpty();
        assertThat(FileUtils.getExtension(Paths.get(".hidden"))).isEmpty();
    }

    @Test
    void getBaseName_stripsLastExtension() {
        assertThat(FileUtils.getBaseName(Paths.get("data/utopia.yaml"))).isEqualTo("utopia");
        assertThat(FileUtils.getBaseName(Paths.get("temoa.db.json"))).isEqualTo("temoa.db");
        assertThat(FileUtils.getBaseName(Paths.get(".hidden"))).isEqualTo(".hidden");
    }

    @Test
    void deleteRecursively_removesTree() throws IOException {
        Path root = tempDir.resolve("run");
        Files.createDirectories(root.resolve("a/b"));
        Files.writeString(root.resolve("a/b/file.dot"), "digraph {}");

        FileUtils.deleteRecursively(root);

        assertThat(root).doesNotExist();
    }

    @Test
    void deleteRecursively_missingPath_doesNothing() throws IOException {
        FileUtils.deleteRecursively(tempDir.resolve("missing"));

        assertThat(tempDir).exists();
    }

    @Test
    void writeString_createsParentDirectories() throws IOException {
        Path target = tempDir.resolve("results/deep/file.dot");

        FileUtils.writeString(target, "content");

        assertThat(target).hasContent("content");
    }
}
