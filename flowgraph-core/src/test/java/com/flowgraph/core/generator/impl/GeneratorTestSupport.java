package com.flowgraph.core.generator.impl;

import com.flowgraph.core.TestEnergySystems;
import com.flowgraph.core.generator.DiagramGenerator;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.generator.ProcessLayout;
import com.flowgraph.core.generator.ScopeKey;
import com.flowgraph.core.source.EnergySystemQuery;
import com.flowgraph.core.source.IndexedEnergySystem;

/**
 * Shared fixture for generator tests: the solved test system and default settings.
 */
abstract class GeneratorTestSupport {

    protected final EnergySystemQuery query = new IndexedEnergySystem(TestEnergySystems.solved());
    protected final EnergySystemQuery unsolved = new IndexedEnergySystem(TestEnergySystems.structureOnly());
    protected final DiagramSettings settings = DiagramSettings.defaults();

    protected GeneratedDiagram draw(DiagramGenerator generator, ScopeKey scope) {
        return draw(generator, scope, settings);
    }

    protected GeneratedDiagram draw(DiagramGenerator generator, ScopeKey scope, DiagramSettings diagramSettings) {
        return generator.generate(query, scope, diagramSettings)
            .orElseThrow(() -> new AssertionError("Expected a diagram for " + scope));
    }

    protected static DiagramSettings withCapacity(DiagramSettings base, ProcessLayout layout) {
        return new DiagramSettings(base.imageFormat(), base.flowThreshold(), layout, true, base.splines(), base.palette());
    }

    /**
     * Returns the body of a subgraph that has no nested subgraphs.
     */
    protected static String section(String dot, String subgraph) {
        int start = dot.indexOf("subgraph " + subgraph + " {");
        if (start < 0) {
            throw new AssertionError("No subgraph " + subgraph + " in:\n" + dot);
        }
        return dot.substring(start, dot.indexOf('}', start));
    }
}
