package com.flowgraph.core.dot;

import java.util.Objects;

/**
 * A node statement of a DOT graph.
 *
 * <p>Equality covers both fields: two nodes with the same id but different attributes
 * are distinct entries and both end up in the rendered output.
 *
 * @param id node identifier, rendered quoted
 * @param attributes attribute list text (e.g. {@code color="red"}), or null when absent
 */
public record Node(
    String id,
    String attributes
) {
    /**
     * Compact constructor with validation. Blank attribute text is normalised to null.
     */
    public Node {
        Objects.requireNonNull(id, "id must not be null");
        if (attributes != null && attributes.isBlank()) {
            attributes = null;
        }
    }

    /**
     * Returns true if this node carries an attribute list.
     *
     * @return true if attributes are present
     */
    public boolean hasAttributes() {
        return attributes != null;
    }
}
