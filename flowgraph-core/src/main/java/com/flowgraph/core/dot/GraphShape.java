package com.flowgraph.core.dot;

/**
 * Shape of the entries held by a {@link GraphSetBuilder}.
 */
public enum GraphShape {
    /** (id, attributes) pairs */
    NODES(2),

    /** (source, destination, attributes) triples */
    EDGES(3);

    private final int arity;

    GraphShape(int arity) {
        this.arity = arity;
    }

    /**
     * Returns the tuple arity of an entry of this shape.
     *
     * @return 2 for nodes, 3 for edges
     */
    public int arity() {
        return arity;
    }
}
