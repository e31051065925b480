package com.flowgraph.core.dot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GraphSetBuilder}.
 */
class GraphSetBuilderTest {

    @Test
    void addNode_sameEntryTwice_keepsOne() {
        GraphSetBuilder<Node> nodes = GraphSetBuilder.nodes();

        nodes.addNode("E01", "color=\"red\"");
        nodes.addNode("E01", "color=\"red\"");

        assertThat(nodes.size()).isEqualTo(1);
        assertThat(nodes.entries()).containsExactly(new Node("E01", "color=\"red\""));
    }

    @Test
    void addNode_sameIdDifferentAttributes_keepsBoth() {
        GraphSetBuilder<Node> nodes = GraphSetBuilder.nodes();

        nodes.addNode("E01", "color=\"red\"");
        nodes.addNode("E01");

        assertThat(nodes.size()).isEqualTo(2);
    }

    @Test
    void addEdge_onNodeBuilder_throwsException() {
        GraphSetBuilder<Node> nodes = GraphSetBuilder.nodes();

        assertThatThrownBy(() -> nodes.addEdge("a", "b"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("EDGES");
    }

    @Test
    void addNode_onEdgeBuilder_throwsException() {
        GraphSetBuilder<Edge> edges = GraphSetBuilder.edges();

        assertThatThrownBy(() -> edges.addNode("a"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void addTuple_wrongArity_throwsException() {
        GraphSetBuilder<Edge> edges = GraphSetBuilder.edges();

        assertThatThrownBy(() -> edges.addTuple("a", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("3-tuple");
    }

    @Test
    void addTuple_edgeTriple_addsEdge() {
        GraphSetBuilder<Edge> edges = GraphSetBuilder.edges();

        edges.addTuple("coal", "E01", null);
        edges.addTuple("coal", 1990, "label=\"x\"");

        assertThat(edges.entries()).containsExactlyInAnyOrder(
            new Edge("coal", "E01", null),
            new Edge("coal", "1990", "label=\"x\""));
    }

    @Test
    void addNode_emptyDotAttributes_storesNoAttributes() {
        GraphSetBuilder<Node> nodes = GraphSetBuilder.nodes();

        nodes.addNode("coal", DotAttributes.create());

        assertThat(nodes.entries()).containsExactly(new Node("coal", null));
    }

    @Test
    void entries_isUnmodifiable() {
        GraphSetBuilder<Node> nodes = GraphSetBuilder.nodes().addNode("coal");

        assertThatThrownBy(() -> nodes.entries().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
