package com.flowgraph.core.generator.impl;

import com.flowgraph.core.dot.DotSerializer;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.generator.ScopeKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link PeriodResultsGenerator}.
 */
class PeriodResultsGeneratorTest extends GeneratorTestSupport {

    private final PeriodResultsGenerator generator = new PeriodResultsGenerator();

    @Test
    void scopes_oneScopePerOptimizedPeriod() {
        assertThat(generator.scopes(query, settings))
            .extracting(ScopeKey::toString)
            .containsExactly("period-results[period=1990]", "period-results[period=2000]");
    }

    @Test
    void scopes_unsolvedModel_isEmpty() {
        assertThat(generator.scopes(unsolved, settings)).isEmpty();
    }

    @Test
    void generate_drawsUsedTechsWithCapacityAndLinks() {
        GeneratedDiagram diagram = draw(generator, scope(1990));

        assertThat(diagram.relativeName()).isEqualTo("results/results1990");
        assertThat(section(diagram.content(), "in_use_techs"))
            .contains("label=\"E01\\nCapacity: 10.00\", href=\"results_E01_1990.svg\"")
            .contains("label=\"IMPCOAL\\nCapacity: 100.00\"")
            .doesNotContain("E70");
        assertThat(section(diagram.content(), "in_use_energy_carriers"))
            .contains("href=\"../commodities/rc_coal_1990.svg\"");
        assertThat(section(diagram.content(), "unused_techs")).contains(DotSerializer.NO_NODES);
    }

    @Test
    void generate_labelsFlowsAndEmissions() {
        String dot = draw(generator, scope(1990)).content();

        assertThat(section(dot, "inputs"))
            .containsPattern("\"coal\"\\s* -> \"E01\"\\s* \\[ label=\"12.00\" \\]")
            .containsPattern("\"ethos\" -> \"IMPCOAL\" \\[ label=\"40.00\" \\]");
        assertThat(section(dot, "outputs"))
            .containsPattern("\"E01\"\\s* -> \"ELC\"\\s* \\[ label=\"5.00\" \\]")
            .containsPattern("\"E01\"\\s* -> \"co2\"\\s* \\[ label=\"2.50\" \\]");
        assertThat(section(dot, "in_use_emissions")).contains("\"co2\" ;");
    }

    @Test
    void generate_zeroCapacityTech_isDrawnAsUnused() {
        String dot = draw(generator, scope(2000)).content();

        assertThat(section(dot, "unused_techs")).contains("\"RL1\" ;");
        assertThat(section(dot, "unused_flows"))
            .contains("\"ELC\" -> \"RL1\" ;")
            .contains("\"RL1\" -> \"RL\" ;");
        assertThat(section(dot, "unused_energy_carriers")).contains("\"RL\" ;").doesNotContain("ELC");
        assertThat(section(dot, "unused_emissions")).contains("\"co2\" ;");
        assertThat(section(dot, "in_use_techs")).contains("label=\"E01\\nCapacity: 15.00\"");
    }

    @Test
    void generate_flowsBelowThreshold_areDrawnAsUnused() {
        DiagramSettings strict = new DiagramSettings("svg", 10.0, settings.processLayout(), false,
            settings.splines(), settings.palette());

        String dot = draw(generator, scope(1990), strict).content();

        assertThat(section(dot, "unused_flows"))
            .containsPattern("\"E01\"\\s* -> \"ELC\"")
            .containsPattern("\"ELC\"\\s* -> \"RL1\"");
        assertThat(section(dot, "inputs")).containsPattern("\"coal\"\\s* -> \"E01\"");
        assertThat(dot).doesNotContain("2.50");
    }

    @Test
    void generate_periodWithoutCapacities_isEmpty() {
        assertThat(generator.generate(query, scope(2010), settings)).isEmpty();
    }

    private static ScopeKey scope(int period) {
        return ScopeKey.of(PeriodResultsGenerator.ID, "period", period);
    }
}
