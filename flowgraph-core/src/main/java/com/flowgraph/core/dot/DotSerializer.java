package com.flowgraph.core.dot;

import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Renders the contents of a {@link GraphSetBuilder} as aligned DOT statements.
 *
 * <p>Output is a pure function of the set contents: lines are sorted by their full
 * rendered text, so the same entries produce byte-identical text whatever order they
 * were added in. Lines are joined with a newline followed by {@code indent} tab
 * characters; the caller is responsible for indenting the first line.
 *
 * <p><b>Node lines</b>
 * <pre>
 * "coal"        [ color="black" ] ;
 * "electricity" [ color="gold" ] ;
 * "oil" ;
 * </pre>
 * The id column of attributed nodes is padded to the widest quoted id among the
 * attributed nodes. Nodes without attributes are not padded.
 *
 * <p><b>Edge lines</b>
 * <pre>
 * "coal" -> "E01"   [ label="1.50" ] ;
 * "oil"  -> "E70" ;
 * </pre>
 * Source and destination columns are padded independently, each to the widest quoted
 * identifier in its column.
 *
 * <p>Empty sets render as a fixed comment so that the enclosing document stays complete.
 */
public final class DotSerializer {

    /** Rendered in place of an empty node set. */
    public static final String NO_NODES = "// no nodes in this section";

    /** Rendered in place of an empty edge set. */
    public static final String NO_EDGES = "// no edges in this section";

    private DotSerializer() {
        // Utility class
    }

    /**
     * Renders node statements.
     *
     * @param nodes node set
     * @param indent number of tabs placed after each line break
     * @return statement block, or {@link #NO_NODES} if the set is empty
     * @throws IllegalArgumentException if the set does not hold nodes or indent is negative
     */
    public static String renderNodes(GraphSetBuilder<?> nodes, int indent) {
        requireShape(nodes, GraphShape.NODES);
        if (nodes.isEmpty()) {
            return NO_NODES;
        }

        int width = 0;
        for (Object entry : nodes.entries()) {
            Node node = (Node) entry;
            if (node.hasAttributes()) {
                width = Math.max(width, quote(node.id()).length());
            }
        }

        SortedSet<String> lines = new TreeSet<>();
        for (Object entry : nodes.entries()) {
            Node node = (Node) entry;
            String id = quote(node.id());
            if (node.hasAttributes()) {
                lines.add(pad(id, width) + " [ " + node.attributes() + " ] ;");
            } else {
                lines.add(id + " ;");
            }
        }
        return join(lines, indent);
    }

    /**
     * Renders edge statements.
     *
     * @param edges edge set
     * @param indent number of tabs placed after each line break
     * @return statement block, or {@link #NO_EDGES} if the set is empty
     * @throws IllegalArgumentException if the set does not hold edges or indent is negative
     */
    public static String renderEdges(GraphSetBuilder<?> edges, int indent) {
        requireShape(edges, GraphShape.EDGES);
        if (edges.isEmpty()) {
            return NO_EDGES;
        }

        int sourceWidth = 0;
        int destinationWidth = 0;
        for (Object entry : edges.entries()) {
            Edge edge = (Edge) entry;
            sourceWidth = Math.max(sourceWidth, quote(edge.source()).length());
            destinationWidth = Math.max(destinationWidth, quote(edge.destination()).length());
        }

        SortedSet<String> lines = new TreeSet<>();
        for (Object entry : edges.entries()) {
            Edge edge = (Edge) entry;
            String source = pad(quote(edge.source()), sourceWidth);
            String destination = quote(edge.destination());
            if (edge.hasAttributes()) {
                lines.add(source + " -> " + pad(destination, destinationWidth) + " [ " + edge.attributes() + " ] ;");
            } else {
                lines.add(source + " -> " + destination + " ;");
            }
        }
        return join(lines, indent);
    }

    /**
     * Quotes an identifier, escaping embedded double quotes and line breaks.
     *
     * @param id raw identifier
     * @return quoted identifier
     */
    public static String quote(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return '"' + escape(id) + '"';
    }

    /**
     * Escapes a value for use inside a DOT double-quoted string.
     *
     * <p>Backslash sequences are left untouched so that DOT escapes such as {@code \n}
     * in labels keep working; only bare double quotes and raw line breaks are escaped.
     *
     * @param value raw value
     * @return escaped value (without surrounding quotes)
     */
    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        int backslashes = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append(backslashes % 2 == 1 ? "\"" : "\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> {
                    continue;
                }
                default -> sb.append(c);
            }
            backslashes = c == '\\' ? backslashes + 1 : 0;
        }
        // a dangling backslash would escape the closing quote
        if (backslashes % 2 == 1) {
            sb.append('\\');
        }
        return sb.toString();
    }

    private static String pad(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }

    private static String join(SortedSet<String> lines, int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        return String.join("\n" + "\t".repeat(indent), lines);
    }

    private static void requireShape(GraphSetBuilder<?> set, GraphShape expected) {
        Objects.requireNonNull(set, "set must not be null");
        if (set.shape() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " set but got " + set.shape());
        }
    }
}
