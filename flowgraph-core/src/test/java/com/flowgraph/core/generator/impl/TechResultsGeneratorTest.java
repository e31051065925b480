package com.flowgraph.core.generator.impl;

import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.generator.ScopeKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link TechResultsGenerator} and {@link FlowSegmentsGenerator}.
 */
class TechResultsGeneratorTest extends GeneratorTestSupport {

    private final TechResultsGenerator techResults = new TechResultsGenerator();
    private final FlowSegmentsGenerator segments = new FlowSegmentsGenerator();

    @Test
    void techResults_scopesFollowReportedCapacities() {
        assertThat(techResults.scopes(query, settings)).hasSize(6)
            .first().hasToString("tech-results[tech=E01, period=1990]");
    }

    @Test
    void techResults_drawsActiveVintagesWithFlowTotals() {
        GeneratedDiagram diagram = draw(techResults, ScopeKey.of(TechResultsGenerator.ID, "tech", "E01", "period", 2000));

        assertThat(diagram.relativeName()).isEqualTo("results/results_E01_2000");
        String dot = diagram.content();
        assertThat(section(dot, "cluster_vintages"))
            .contains("label = \"Vintages\\nCapacity: 15.00\" ;")
            .contains("href = \"results2000.svg\" ;")
            .contains("\"1990\" [ href=\"results_E01_p2000v1990_segments.svg\", label=\"1990\\nCap: 10.00\" ] ;")
            .contains("\"2000\" [ href=\"results_E01_p2000v2000_segments.svg\", label=\"2000\\nCap: 5.00\" ] ;");
        assertThat(section(dot, "inputs"))
            .contains("\"coal\" -> \"1990\" [ label=\"8.00\" ] ;")
            .contains("\"coal\" -> \"2000\" [ label=\"4.00\" ] ;");
        assertThat(section(dot, "outputs"))
            .contains("\"1990\" -> \"ELC\" [ label=\"3.00\" ] ;")
            .contains("\"2000\" -> \"ELC\" [ label=\"1.50\" ] ;");
        assertThat(section(dot, "energy_carriers")).contains("href=\"../commodities/rc_coal_2000.svg\"");
    }

    @Test
    void techResults_noActiveVintage_isEmpty() {
        assertThat(techResults.generate(query, ScopeKey.of(TechResultsGenerator.ID, "tech", "RL1", "period", 2000), settings))
            .isEmpty();
    }

    @Test
    void flowSegments_scopesSkipProcessesWithoutActivity() {
        assertThat(segments.scopes(query, settings))
            .extracting(ScopeKey::toString)
            .containsExactly(
                "flow-segments[tech=E01, period=1990, vintage=1990]",
                "flow-segments[tech=IMPCOAL, period=1990, vintage=1990]",
                "flow-segments[tech=RL1, period=1990, vintage=1990]",
                "flow-segments[tech=E01, period=2000, vintage=1990]",
                "flow-segments[tech=E01, period=2000, vintage=2000]",
                "flow-segments[tech=IMPCOAL, period=2000, vintage=1990]");
    }

    @Test
    void flowSegments_drawsOneNodePerTimeSliceWithFlow() {
        GeneratedDiagram diagram = draw(segments, segmentScope("E01", 1990, 1990));

        assertThat(diagram.relativeName()).isEqualTo("results/results_E01_p1990v1990_segments");
        String dot = diagram.content();
        assertThat(section(dot, "cluster_slices"))
            .contains("label = \"1990 Capacity: 10.00\" ;")
            .contains("href = \"results_E01_1990.svg\" ;")
            .contains("\"summer, night\" ;")
            .contains("\"winter, day\" ;")
            .doesNotContain("summer, day");
        assertThat(section(dot, "inputs"))
            .containsPattern("\"coal\" -> \"winter, day\"\\s* \\[ label=\"5.00\" \\]")
            .containsPattern("\"coal\" -> \"summer, night\" \\[ label=\"7.00\" \\]");
        assertThat(section(dot, "outputs"))
            .containsPattern("\"winter, day\"\\s* -> \"ELC\" \\[ label=\"2.00\" \\]")
            .containsPattern("\"summer, night\" -> \"ELC\" \\[ label=\"3.00\" \\]");
    }

    @Test
    void flowSegments_clusterLabelShowsPeriodCapacityOfTech() {
        GeneratedDiagram diagram = draw(segments, segmentScope("E01", 2000, 2000));

        assertThat(section(diagram.content(), "cluster_slices"))
            .contains("label = \"2000 Capacity: 15.00\" ;")
            .doesNotContain("Capacity: 5.00");
    }

    @Test
    void flowSegments_processWithoutFlows_isEmpty() {
        assertThat(segments.generate(query, segmentScope("E70", 1990, 1990), settings)).isEmpty();
    }

    private static ScopeKey segmentScope(String tech, int period, int vintage) {
        return ScopeKey.of(FlowSegmentsGenerator.ID, "tech", tech, "period", period, "vintage", vintage);
    }
}
