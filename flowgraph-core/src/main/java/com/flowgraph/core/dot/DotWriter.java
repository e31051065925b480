package com.flowgraph.core.dot;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Appends the structural statements of a DOT document.
 *
 * <p>Replaces hand-written document templates: each call appends one validated
 * statement at the current nesting depth, and node/edge sections are serialized
 * through {@link DotSerializer} at the same depth. Every {@code begin*} call must be
 * matched by {@link #end()} before {@link #build()}.
 *
 * <pre>{@code
 * String dot = new DotWriter()
 *     .comment("generated")
 *     .beginStrictDigraph("model")
 *     .graphAttribute("rankdir", "LR")
 *     .beginSubgraph("techs")
 *     .nodeDefaults(DotAttributes.create().add("shape", "box"))
 *     .blankLine()
 *     .nodes(techs)
 *     .end()
 *     .end()
 *     .build();
 * }</pre>
 */
public final class DotWriter {

    private static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final StringBuilder out = new StringBuilder();
    private int depth;

    /**
     * Appends a {@code //} comment line. Multi-line text produces one comment per line.
     *
     * @param text comment text
     * @return this writer
     */
    public DotWriter comment(String text) {
        for (String line : text.split("\n", -1)) {
            line(line.isEmpty() ? "//" : "// " + line);
        }
        return this;
    }

    public DotWriter blankLine() {
        out.append('\n');
        return this;
    }

    /**
     * Opens a {@code strict digraph}; duplicate identical edges collapse at layout time.
     *
     * @param name graph name
     * @return this writer
     */
    public DotWriter beginStrictDigraph(String name) {
        if (depth != 0) {
            throw new IllegalStateException("A graph can only be opened at the top level");
        }
        return open("strict digraph " + id(name));
    }

    /**
     * Opens a named subgraph. Names starting with {@code cluster} are drawn as clusters.
     *
     * @param name subgraph name
     * @return this writer
     */
    public DotWriter beginSubgraph(String name) {
        requireOpen();
        return open("subgraph " + id(name));
    }

    /**
     * Appends a graph-level attribute statement, {@code key = "value" ;}.
     *
     * @param key attribute name
     * @param value attribute value
     * @return this writer
     */
    public DotWriter graphAttribute(String key, Object value) {
        requireOpen();
        line(DotAttributes.create().add(key, value).toString().replaceFirst("=", " = ") + " ;");
        return this;
    }

    public DotWriter nodeDefaults(DotAttributes attributes) {
        return defaults("node", attributes);
    }

    public DotWriter edgeDefaults(DotAttributes attributes) {
        return defaults("edge", attributes);
    }

    /**
     * Appends a serialized node section at the current depth.
     *
     * @param nodes node set
     * @return this writer
     */
    public DotWriter nodes(GraphSetBuilder<Node> nodes) {
        requireOpen();
        line(DotSerializer.renderNodes(nodes, depth));
        return this;
    }

    /**
     * Appends a serialized edge section at the current depth.
     *
     * @param edges edge set
     * @return this writer
     */
    public DotWriter edges(GraphSetBuilder<Edge> edges) {
        requireOpen();
        line(DotSerializer.renderEdges(edges, depth));
        return this;
    }

    /**
     * Closes the innermost open graph or subgraph.
     *
     * @return this writer
     */
    public DotWriter end() {
        requireOpen();
        depth--;
        line("}");
        return this;
    }

    public int depth() {
        return depth;
    }

    /**
     * Returns the document text.
     *
     * @return DOT document
     * @throws IllegalStateException if a graph or subgraph is still open
     */
    public String build() {
        if (depth != 0) {
            throw new IllegalStateException("Unclosed graph or subgraph (depth " + depth + ")");
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return out.toString();
    }

    private DotWriter defaults(String kind, DotAttributes attributes) {
        requireOpen();
        Objects.requireNonNull(attributes, "attributes must not be null");
        line(kind + " [ " + attributes + " ] ;");
        return this;
    }

    private DotWriter open(String header) {
        line(header + " {");
        depth++;
        return this;
    }

    private void line(String text) {
        out.append("\t".repeat(depth)).append(text).append('\n');
    }

    private void requireOpen() {
        if (depth == 0) {
            throw new IllegalStateException("No graph is open");
        }
    }

    private static String id(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return PLAIN_ID.matcher(name).matches() ? name : DotSerializer.quote(name);
    }
}
