package com.flowgraph.core.generator;

import java.util.Objects;

/**
 * Represents a generated diagram.
 *
 * @param relativeName path of the diagram relative to the run root, without extension
 *                     (e.g. {@code commodities/commodity_ELC})
 * @param content DOT document text
 */
public record GeneratedDiagram(
    String relativeName,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(relativeName, "relativeName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativeName.startsWith("/") || relativeName.contains("..")) {
            throw new IllegalArgumentException("relativeName must stay inside the run directory: " + relativeName);
        }
    }

    /**
     * Returns the relative path of the DOT artifact.
     *
     * @return artifact path, e.g. {@code commodities/commodity_ELC.dot}
     */
    public String artifactPath() {
        return relativeName + ".dot";
    }

    /**
     * Returns the relative path of the rendered image.
     *
     * @param imageFormat image format, e.g. {@code svg}
     * @return image path
     */
    public String imagePath(String imageFormat) {
        return relativeName + "." + imageFormat;
    }
}
