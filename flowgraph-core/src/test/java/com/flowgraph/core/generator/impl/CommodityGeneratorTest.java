package com.flowgraph.core.generator.impl;

import com.flowgraph.core.generator.DiagramCategory;
import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.generator.ScopeKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CommodityGenerator}.
 */
class CommodityGeneratorTest extends GeneratorTestSupport {

    private final CommodityGenerator generator = new CommodityGenerator();

    @Test
    void getCategory_isCommodities() {
        assertThat(generator.getCategory()).isEqualTo(DiagramCategory.COMMODITIES);
    }

    @Test
    void scopes_coverCarriersOfActiveProcesses() {
        assertThat(generator.scopes(query, settings))
            .extracting(s -> s.get("commodity"))
            .containsExactly("ELC", "RL", "coal", "ethos");
    }

    @Test
    void generate_linksCarrierToOverviewAndTechsToProcesses() {
        GeneratedDiagram diagram = draw(generator, ScopeKey.of(CommodityGenerator.ID, "commodity", "coal"));

        assertThat(diagram.relativeName()).isEqualTo("commodities/commodity_coal");
        assertThat(diagram.imagePath("svg")).isEqualTo("commodities/commodity_coal.svg");

        String dot = diagram.content();
        assertThat(dot).contains("label = \"coal\" ;");
        assertThat(section(dot, "energy_carriers")).contains("\"coal\" [ href=\"../simple_model.svg\" ] ;");
        assertThat(section(dot, "techs"))
            .contains("href=\"../processes/process_E01.svg\"")
            .contains("href=\"../processes/process_E70.svg\"")
            .contains("href=\"../processes/process_IMPCOAL.svg\"");
    }

    @Test
    void generate_separatesConsumersFromProducers() {
        String dot = draw(generator, ScopeKey.of(CommodityGenerator.ID, "commodity", "coal")).content();

        assertThat(section(dot, "inputs"))
            .contains("\"coal\" -> \"E01\" ;")
            .contains("\"coal\" -> \"E70\" ;")
            .doesNotContain("IMPCOAL");
        assertThat(section(dot, "outputs")).contains("\"IMPCOAL\" -> \"coal\" ;");
    }

    @Test
    void generate_unknownCarrier_isEmpty() {
        assertThat(generator.generate(query, ScopeKey.of(CommodityGenerator.ID, "commodity", "gas"), settings))
            .isEmpty();
    }
}
