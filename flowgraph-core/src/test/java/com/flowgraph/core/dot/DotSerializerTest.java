package com.flowgraph.core.dot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DotSerializer}.
 */
class DotSerializerTest {

    @Test
    void renderNodes_emptySet_returnsPlaceholderComment() {
        assertThat(DotSerializer.renderNodes(GraphSetBuilder.nodes(), 1)).isEqualTo(DotSerializer.NO_NODES);
    }

    @Test
    void renderEdges_emptySet_returnsPlaceholderComment() {
        assertThat(DotSerializer.renderEdges(GraphSetBuilder.edges(), 1)).isEqualTo(DotSerializer.NO_EDGES);
    }

    @Test
    void renderNodes_padsAttributedIdsOnly() {
        GraphSetBuilder<Node> nodes = GraphSetBuilder.nodes()
            .addNode("coal", "color=\"black\"")
            .addNode("electricity", "color=\"gold\"")
            .addNode("oil");

        String text = DotSerializer.renderNodes(nodes, 0);

        assertThat(text).isEqualTo(
            "\"coal\"        [ color=\"black\" ] ;\n"
                + "\"electricity\" [ color=\"gold\" ] ;\n"
                + "\"oil\" ;");
    }

    @Test
    void renderEdges_padsSourceAndDestinationColumns() {
        GraphSetBuilder<Edge> edges = GraphSetBuilder.edges()
            .addEdge("coal", "E01", "label=\"1.50\"")
            .addEdge("oil", "E70");

        String text = DotSerializer.renderEdges(edges, 0);

        assertThat(text).isEqualTo(
            "\"coal\" -> \"E01\" [ label=\"1.50\" ] ;\n"
                + "\"oil\"  -> \"E70\" ;");
    }

    @Test
    void renderNodes_insertionOrderDoesNotMatter() {
        GraphSetBuilder<Node> first = GraphSetBuilder.nodes().addNode("b").addNode("a", "x=\"1\"").addNode("c");
        GraphSetBuilder<Node> second = GraphSetBuilder.nodes().addNode("c").addNode("b").addNode("a", "x=\"1\"");

        assertThat(DotSerializer.renderNodes(first, 2)).isEqualTo(DotSerializer.renderNodes(second, 2));
    }

    @Test
    void renderEdges_duplicateEntries_renderOneLine() {
        GraphSetBuilder<Edge> edges = GraphSetBuilder.edges().addTuple("x", "y", null).addTuple("x", "y", null);

        assertThat(DotSerializer.renderEdges(edges, 0)).isEqualTo("\"x\" -> \"y\" ;");
    }

    @Test
    void renderEdges_insertionOrderDoesNotMatter() {
        GraphSetBuilder<Edge> first = GraphSetBuilder.edges()
            .addEdge("coal", "E01", "color=\"red\"")
            .addEdge("E01", "ELC")
            .addEdge("ethos", "IMPCOAL", "label=\"  \"");
        GraphSetBuilder<Edge> second = GraphSetBuilder.edges()
            .addEdge("ethos", "IMPCOAL", "label=\"  \"")
            .addEdge("coal", "E01", "color=\"red\"")
            .addEdge("E01", "ELC");

        assertThat(DotSerializer.renderEdges(first, 1)).isEqualTo(DotSerializer.renderEdges(second, 1));
    }

    @Test
    void renderNodes_indentsContinuationLines() {
        GraphSetBuilder<Node> nodes = GraphSetBuilder.nodes().addNode("a").addNode("b");

        assertThat(DotSerializer.renderNodes(nodes, 2)).isEqualTo("\"a\" ;\n\t\t\"b\" ;");
    }

    @Test
    void renderNodes_negativeIndent_throwsException() {
        GraphSetBuilder<Node> nodes = GraphSetBuilder.nodes().addNode("a");

        assertThatThrownBy(() -> DotSerializer.renderNodes(nodes, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void renderNodes_withEdgeSet_throwsException() {
        assertThatThrownBy(() -> DotSerializer.renderNodes(GraphSetBuilder.edges(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void quote_escapesBareDoubleQuotes() {
        assertThat(DotSerializer.quote("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
    }

    @Test
    void quote_keepsAlreadyEscapedQuote() {
        assertThat(DotSerializer.quote("a\\\"b")).isEqualTo("\"a\\\"b\"");
    }

    @Test
    void quote_escapedBackslashBeforeQuote_escapesQuote() {
        // a\\"b: the backslashes escape each other, the quote is bare
        assertThat(DotSerializer.quote("a\\\\\"b")).isEqualTo("\"a\\\\\\\"b\"");
    }

    @Test
    void quote_trailingBackslash_isPadded() {
        assertThat(DotSerializer.quote("dir\\")).isEqualTo("\"dir\\\\\"");
    }

    @Test
    void quote_keepsDotLineBreakEscapes() {
        assertThat(DotSerializer.quote("2000\\nCap: 1.00")).isEqualTo("\"2000\\nCap: 1.00\"");
    }

    @Test
    void quote_rawLineBreaks_becomeEscapes() {
        assertThat(DotSerializer.quote("a\r\nb")).isEqualTo("\"a\\nb\"");
    }
}
