package com.flowgraph.core.generator;

import java.util.Objects;

/**
 * Read-only settings shared by all diagram jobs of a batch.
 *
 * @param imageFormat renderer output format and image extension (e.g. {@code svg})
 * @param flowThreshold flows below this magnitude are drawn as unused; only suppresses
 *                      visually insignificant edges
 * @param processLayout layout of per-technology process diagrams
 * @param showCapacity whether process diagrams label nodes with capacities
 * @param splines Graphviz {@code splines} value for result diagrams
 * @param palette diagram colours
 */
public record DiagramSettings(
    String imageFormat,
    double flowThreshold,
    ProcessLayout processLayout,
    boolean showCapacity,
    String splines,
    Palette palette
) {
    /** Default flow threshold: flows are reported with two decimals. */
    public static final double DEFAULT_FLOW_THRESHOLD = 0.005;

    /**
     * Compact constructor with validation.
     */
    public DiagramSettings {
        Objects.requireNonNull(imageFormat, "imageFormat must not be null");
        Objects.requireNonNull(processLayout, "processLayout must not be null");
        Objects.requireNonNull(splines, "splines must not be null");
        Objects.requireNonNull(palette, "palette must not be null");
        if (imageFormat.isBlank() || !imageFormat.matches("[A-Za-z0-9_:]+")) {
            throw new IllegalArgumentException("Invalid image format: " + imageFormat);
        }
        if (flowThreshold < 0 || Double.isNaN(flowThreshold)) {
            throw new IllegalArgumentException("flowThreshold must not be negative: " + flowThreshold);
        }
    }

    /**
     * Creates default settings.
     *
     * @return svg output, default threshold, separate-vintage layout, default palette
     */
    public static DiagramSettings defaults() {
        return new DiagramSettings("svg", DEFAULT_FLOW_THRESHOLD, ProcessLayout.SEPARATE_VINTAGES,
            false, "true", Palette.defaults());
    }

    /**
     * Returns true if a flow is large enough to be drawn as in use.
     *
     * @param value flow magnitude
     * @return true if at or above the threshold
     */
    public boolean isSignificant(double value) {
        return value >= flowThreshold;
    }
}
