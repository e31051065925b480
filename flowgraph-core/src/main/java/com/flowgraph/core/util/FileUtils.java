package com.flowgraph.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return base name, e.g. {@code utopia} for {@code data/utopia.yaml}
     */
    public static String getBaseName(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Deletes a directory and everything below it. Does nothing if the path does not exist.
     *
     * @param root directory to delete
     * @throws IOException if any entry cannot be deleted
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }

        List<Path> entries;
        try (Stream<Path> paths = Files.walk(root)) {
            entries = paths.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path entry : entries) {
            Files.delete(entry);
        }
    }

    /**
     * Writes text to a file, creating missing parent directories.
     *
     * @param target file to write
     * @param content text content
     * @throws IOException if writing fails
     */
    public static void writeString(Path target, String content) throws IOException {
        Path parentDir = target.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(target, content);
    }
}
