package com.flowgraph.core.generator;

/**
 * Families of diagrams, each written to its own directory below the run root.
 */
public enum DiagramCategory {
    /** Whole-system diagrams at the top of the run directory */
    SYSTEM(""),

    /** Per-carrier diagrams */
    COMMODITIES("commodities"),

    /** Per-technology diagrams */
    PROCESSES("processes"),

    /** Result diagrams per period, technology and process */
    RESULTS("results");

    private final String directoryName;

    DiagramCategory(String directoryName) {
        this.directoryName = directoryName;
    }

    /**
     * Returns the directory name relative to the run root; empty for the root itself.
     *
     * @return directory name
     */
    public String directoryName() {
        return directoryName;
    }

    /**
     * Returns the relative path of a file in this category's directory.
     *
     * @param fileName file name
     * @return relative path
     */
    public String resolve(String fileName) {
        return directoryName.isEmpty() ? fileName : directoryName + "/" + fileName;
    }
}
