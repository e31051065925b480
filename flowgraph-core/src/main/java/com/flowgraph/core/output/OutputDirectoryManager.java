package com.flowgraph.core.output;

import com.flowgraph.core.generator.DiagramCategory;
import com.flowgraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Creates a fresh run directory for a batch.
 *
 * <p>Preparing is destructive: a previous run directory of the same name is deleted with
 * everything in it, so stale diagrams never mix with the new ones. The directory is then
 * recreated with one subdirectory per {@link DiagramCategory}.
 */
public class OutputDirectoryManager {

    private static final Logger log = LoggerFactory.getLogger(OutputDirectoryManager.class);

    /** Prefix of run directory names */
    public static final String RUN_PREFIX = "images_";

    /**
     * Derives the run directory name from the first dataset.
     *
     * @param firstDataset first dataset file, e.g. {@code data/utopia.yaml}
     * @return run name, e.g. {@code images_utopia}
     */
    public static String runName(Path firstDataset) {
        Objects.requireNonNull(firstDataset, "firstDataset must not be null");
        return RUN_PREFIX + FileUtils.getBaseName(firstDataset);
    }

    /**
     * Deletes and recreates {@code <parent>/<runName>} with its category subdirectories.
     *
     * @param parent absolute parent directory; created if missing
     * @param runName run directory name, a single path segment
     * @return prepared layout
     * @throws IllegalArgumentException if parent is relative or runName is not a plain name
     * @throws OutputDirectoryException if the directory cannot be deleted or created
     */
    public OutputLayout prepare(Path parent, String runName) {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(runName, "runName must not be null");
        if (!parent.isAbsolute()) {
            throw new IllegalArgumentException("Output directory must be absolute: " + parent);
        }
        if (runName.isBlank() || runName.contains("/") || runName.contains("\\") || runName.equals("..") || runName.equals(".")) {
            throw new IllegalArgumentException("Invalid run name: '" + runName + "'");
        }

        Path root = parent.resolve(runName).normalize();
        try {
            if (Files.exists(root)) {
                log.info("Removing previous run directory: {}", root);
                FileUtils.deleteRecursively(root);
            }
            Files.createDirectories(root);
            for (DiagramCategory category : DiagramCategory.values()) {
                if (!category.directoryName().isEmpty()) {
                    Files.createDirectory(root.resolve(category.directoryName()));
                }
            }
        } catch (IOException e) {
            throw new OutputDirectoryException("Failed to prepare output directory: " + root, e);
        }

        log.debug("Prepared run directory: {}", root);
        return new OutputLayout(root);
    }
}
