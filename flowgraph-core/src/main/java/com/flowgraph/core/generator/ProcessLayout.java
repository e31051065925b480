package com.flowgraph.core.generator;

/**
 * Layout strategies for per-technology process diagrams.
 */
public enum ProcessLayout {
    /** Vintages and periods drawn as two clusters connected by coloured edges */
    SEPARATE_VINTAGES,

    /** One node per (period, vintage) pair with explicit input and output edges */
    EXPLICIT_VINTAGES
}
