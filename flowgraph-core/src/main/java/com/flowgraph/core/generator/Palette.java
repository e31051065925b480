package com.flowgraph.core.generator;

import java.util.List;
import java.util.Objects;

/**
 * Colours used in generated diagrams. Values are Graphviz colour names.
 *
 * @param techColor fill colour of technology nodes
 * @param commodityColor fill colour of carrier nodes
 * @param unusedColor fill colour of inactive nodes and edges
 * @param inputArrowColor colour of carrier-to-technology edges
 * @param outputArrowColor colour of technology-to-carrier edges
 * @param usedFontColor font colour of active nodes
 * @param unusedFontColor font colour of inactive nodes
 * @param incomingCommodityColor input carrier colour in process diagrams
 * @param outgoingCommodityColor output carrier colour in process diagrams
 * @param clusterColor background colour of vintage and period clusters
 * @param clusterNodeColor node colour inside clusters
 * @param usedFlowColor colour of in-use flows in carrier result diagrams
 * @param rainbow edge colours cycled through in separate-vintage process diagrams
 */
public record Palette(
    String techColor,
    String commodityColor,
    String unusedColor,
    String inputArrowColor,
    String outputArrowColor,
    String usedFontColor,
    String unusedFontColor,
    String incomingCommodityColor,
    String outgoingCommodityColor,
    String clusterColor,
    String clusterNodeColor,
    String usedFlowColor,
    List<String> rainbow
) {
    /**
     * Compact constructor with validation.
     */
    public Palette {
        Objects.requireNonNull(techColor, "techColor must not be null");
        Objects.requireNonNull(commodityColor, "commodityColor must not be null");
        Objects.requireNonNull(unusedColor, "unusedColor must not be null");
        Objects.requireNonNull(inputArrowColor, "inputArrowColor must not be null");
        Objects.requireNonNull(outputArrowColor, "outputArrowColor must not be null");
        Objects.requireNonNull(usedFontColor, "usedFontColor must not be null");
        Objects.requireNonNull(unusedFontColor, "unusedFontColor must not be null");
        Objects.requireNonNull(incomingCommodityColor, "incomingCommodityColor must not be null");
        Objects.requireNonNull(outgoingCommodityColor, "outgoingCommodityColor must not be null");
        Objects.requireNonNull(clusterColor, "clusterColor must not be null");
        Objects.requireNonNull(clusterNodeColor, "clusterNodeColor must not be null");
        Objects.requireNonNull(usedFlowColor, "usedFlowColor must not be null");
        if (rainbow == null || rainbow.isEmpty()) {
            throw new IllegalArgumentException("rainbow must contain at least one colour");
        }
        rainbow = List.copyOf(rainbow);
    }

    /**
     * Creates the default palette.
     *
     * @return default palette
     */
    public static Palette defaults() {
        return new Palette(
            "darkseagreen",
            "lightsteelblue",
            "powderblue",
            "firebrick",
            "forestgreen",
            "black",
            "chocolate",
            "lightsteelblue",
            "lawngreen",
            "lightgrey",
            "white",
            "forestgreen",
            List.of("red", "orange", "gold", "green", "blue", "purple", "hotpink",
                "cyan", "burlywood", "coral", "limegreen", "black", "brown")
        );
    }
}
