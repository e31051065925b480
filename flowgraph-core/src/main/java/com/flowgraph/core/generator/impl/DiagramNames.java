package com.flowgraph.core.generator.impl;

import com.flowgraph.core.generator.DiagramCategory;

/**
 * File names of the generated diagrams, shared so that cross-diagram links match the
 * files that are actually written.
 */
final class DiagramNames {

    static final String ALL_VINTAGES_MODEL = "all_vintages_model";
    static final String SIMPLE_MODEL = "simple_model";

    private DiagramNames() {
        // Utility class
    }

    static String commodity(String carrier) {
        return "commodity_" + carrier;
    }

    static String process(String tech) {
        return "process_" + tech;
    }

    static String periodResults(int period) {
        return "results" + period;
    }

    static String techResults(String tech, int period) {
        return "results_" + tech + "_" + period;
    }

    static String flowSegments(String tech, int period, int vintage) {
        return "results_" + tech + "_p" + period + "v" + vintage + "_segments";
    }

    static String commodityResults(String carrier, int period) {
        return "rc_" + carrier + "_" + period;
    }

    /**
     * Returns the path of another diagram's image relative to a diagram in {@code from}.
     *
     * @param from category of the linking diagram
     * @param to category of the linked diagram
     * @param name file name of the linked diagram, without extension
     * @param imageFormat image extension
     * @return relative link target
     */
    static String link(DiagramCategory from, DiagramCategory to, String name, String imageFormat) {
        String file = name + "." + imageFormat;
        if (from == to) {
            return file;
        }
        String target = to.resolve(file);
        return from == DiagramCategory.SYSTEM ? target : "../" + target;
    }
}
