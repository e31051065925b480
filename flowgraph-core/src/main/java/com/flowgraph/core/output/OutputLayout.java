package com.flowgraph.core.output;

import com.flowgraph.core.generator.DiagramCategory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A prepared run directory.
 *
 * @param root absolute path of the run directory, e.g. {@code /tmp/out/images_utopia}
 */
public record OutputLayout(Path root) {

    /**
     * Compact constructor with validation.
     */
    public OutputLayout {
        Objects.requireNonNull(root, "root must not be null");
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("root must be absolute: " + root);
        }
        root = root.normalize();
    }

    /**
     * Resolves a path relative to the run directory.
     *
     * @param relativePath relative path, e.g. {@code commodities/commodity_ELC.dot}
     * @return absolute path inside the run directory
     * @throws IllegalArgumentException if the path escapes the run directory
     */
    public Path resolve(String relativePath) {
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Path escapes the run directory: " + relativePath);
        }
        return resolved;
    }

    public Path categoryDirectory(DiagramCategory category) {
        return category.directoryName().isEmpty() ? root : root.resolve(category.directoryName());
    }
}
