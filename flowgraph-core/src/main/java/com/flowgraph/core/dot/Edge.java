package com.flowgraph.core.dot;

import java.util.Objects;

/**
 * An edge statement ({@code source -> destination}) of a DOT graph.
 *
 * @param source source node identifier
 * @param destination destination node identifier
 * @param attributes attribute list text, or null when absent
 */
public record Edge(
    String source,
    String destination,
    String attributes
) {
    /**
     * Compact constructor with validation. Blank attribute text is normalised to null.
     */
    public Edge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        if (attributes != null && attributes.isBlank()) {
            attributes = null;
        }
    }

    /**
     * Returns true if this edge carries an attribute list.
     *
     * @return true if attributes are present
     */
    public boolean hasAttributes() {
        return attributes != null;
    }
}
