package com.flowgraph.core.dot;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Accumulates the deduplicated node or edge statements of one diagram section.
 *
 * <p>A builder has a fixed {@link GraphShape}: it holds either {@link Node}s or
 * {@link Edge}s, never both. Adding an entry of the other shape is a programming
 * error and fails immediately. Adding the same entry twice has no effect.
 *
 * <p>Builders are created, filled and serialized inside a single diagram job and are
 * not thread-safe.
 *
 * <pre>{@code
 * GraphSetBuilder<Node> techs = GraphSetBuilder.nodes();
 * techs.addNode("E01", DotAttributes.create().add("href", "processes/process_E01.svg"));
 * techs.addNode("E01", DotAttributes.create().add("href", "processes/process_E01.svg")); // no-op
 *
 * GraphSetBuilder<Edge> inputs = GraphSetBuilder.edges();
 * inputs.addEdge("coal", "E01");
 * }</pre>
 *
 * @param <T> entry type, {@link Node} or {@link Edge}
 * @see DotSerializer
 */
public final class GraphSetBuilder<T> {

    private final GraphShape shape;
    private final Set<T> entries = new HashSet<>();

    private GraphSetBuilder(GraphShape shape) {
        this.shape = shape;
    }

    /**
     * Creates an empty builder for node statements.
     *
     * @return node builder
     */
    public static GraphSetBuilder<Node> nodes() {
        return new GraphSetBuilder<>(GraphShape.NODES);
    }

    /**
     * Creates an empty builder for edge statements.
     *
     * @return edge builder
     */
    public static GraphSetBuilder<Edge> edges() {
        return new GraphSetBuilder<>(GraphShape.EDGES);
    }

    public GraphShape shape() {
        return shape;
    }

    /**
     * Adds a node without attributes.
     *
     * @param id node identifier
     * @return this builder
     */
    public GraphSetBuilder<T> addNode(String id) {
        return addNode(id, (String) null);
    }

    /**
     * Adds a node with a raw attribute string.
     *
     * @param id node identifier
     * @param attributes attribute text, or null
     * @return this builder
     * @throws IllegalStateException if this is an edge builder
     */
    public GraphSetBuilder<T> addNode(String id, String attributes) {
        requireShape(GraphShape.NODES);
        add(new Node(id, attributes));
        return this;
    }

    /**
     * Adds a node with a structured attribute list.
     *
     * @param id node identifier
     * @param attributes attribute list; an empty list means no attributes
     * @return this builder
     */
    public GraphSetBuilder<T> addNode(String id, DotAttributes attributes) {
        return addNode(id, attributes == null ? null : attributes.renderOrNull());
    }

    /**
     * Adds an edge without attributes.
     *
     * @param source source identifier
     * @param destination destination identifier
     * @return this builder
     */
    public GraphSetBuilder<T> addEdge(String source, String destination) {
        return addEdge(source, destination, (String) null);
    }

    /**
     * Adds an edge with a raw attribute string.
     *
     * @param source source identifier
     * @param destination destination identifier
     * @param attributes attribute text, or null
     * @return this builder
     * @throws IllegalStateException if this is a node builder
     */
    public GraphSetBuilder<T> addEdge(String source, String destination, String attributes) {
        requireShape(GraphShape.EDGES);
        add(new Edge(source, destination, attributes));
        return this;
    }

    /**
     * Adds an edge with a structured attribute list.
     *
     * @param source source identifier
     * @param destination destination identifier
     * @param attributes attribute list; an empty list means no attributes
     * @return this builder
     */
    public GraphSetBuilder<T> addEdge(String source, String destination, DotAttributes attributes) {
        return addEdge(source, destination, attributes == null ? null : attributes.renderOrNull());
    }

    /**
     * Adds a raw tuple: {@code (id, attributes)} for node builders or
     * {@code (source, destination, attributes)} for edge builders.
     *
     * <p>Tuple values are converted with {@link String#valueOf(Object)}; the trailing
     * attribute value may be null.
     *
     * @param values tuple values
     * @return this builder
     * @throws IllegalArgumentException if the tuple arity does not match the builder shape
     */
    public GraphSetBuilder<T> addTuple(Object... values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length != shape.arity()) {
            throw new IllegalArgumentException(
                "Expected a " + shape.arity() + "-tuple for " + shape + " but got " + values.length + " values");
        }
        return switch (shape) {
            case NODES -> addNode(text(values[0]), nullableText(values[1]));
            case EDGES -> addEdge(text(values[0]), text(values[1]), nullableText(values[2]));
        };
    }

    /**
     * Returns an unmodifiable view of the entries, in no particular order.
     *
     * @return entries
     */
    public Set<T> entries() {
        return Collections.unmodifiableSet(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @SuppressWarnings("unchecked")
    private void add(Object entry) {
        entries.add((T) entry);
    }

    private void requireShape(GraphShape expected) {
        if (shape != expected) {
            throw new IllegalStateException("Cannot add " + expected + " entry to a " + shape + " set");
        }
    }

    private static String text(Object value) {
        Objects.requireNonNull(value, "tuple identifier must not be null");
        return String.valueOf(value);
    }

    private static String nullableText(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
