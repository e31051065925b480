package com.flowgraph.core.generator.impl;

import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.generator.ScopeKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CommodityResultsGenerator}.
 */
class CommodityResultsGeneratorTest extends GeneratorTestSupport {

    private final CommodityResultsGenerator generator = new CommodityResultsGenerator();

    @Test
    void scopes_crossPeriodsWithUsedCarriers() {
        assertThat(generator.scopes(query, settings)).hasSize(8)
            .first().hasToString("commodity-results[commodity=ELC, period=1990]");
        assertThat(generator.scopes(unsolved, settings)).isEmpty();
    }

    @Test
    void usage_excludesTechsWithoutSignificantFlow() {
        CommodityResultsGenerator.Usage usage = CommodityResultsGenerator.Usage.of(query, settings);

        assertThat(usage.techs()).containsExactly("E01", "IMPCOAL", "RL1");
        assertThat(usage.carriers()).containsExactly("ELC", "RL", "coal", "ethos");
    }

    @Test
    void generate_splitsUsedAndUnusedTechs() {
        GeneratedDiagram diagram = draw(generator, scope("coal", 1990));

        assertThat(diagram.relativeName()).isEqualTo("commodities/rc_coal_1990");
        String dot = diagram.content();
        assertThat(dot)
            .contains("strict digraph result_commodity_coal {")
            .contains("\"coal\" [ color=\"lightsteelblue\", href=\"../results/results1990.svg\", shape=\"circle\" ] ;");
        assertThat(section(dot, "used_techs"))
            .contains("href=\"../results/results_E01_1990.svg\"")
            .contains("href=\"../results/results_IMPCOAL_1990.svg\"");
        assertThat(section(dot, "unused_techs")).contains("\"E70\" ;");
        assertThat(section(dot, "in_use_flows"))
            .containsPattern("\"coal\"\\s* -> \"E01\" ;")
            .contains("\"IMPCOAL\" -> \"coal\" ;");
        assertThat(section(dot, "unused_flows")).contains("\"coal\" -> \"E70\" ;");
    }

    @Test
    void generate_unknownCarrier_isEmpty() {
        assertThat(generator.generate(query, scope("gas", 1990), settings)).isEmpty();
    }

    private static ScopeKey scope(String carrier, int period) {
        return ScopeKey.of(CommodityResultsGenerator.ID, "commodity", carrier, "period", period);
    }
}
