package com.flowgraph.core.generator.impl;

import com.flowgraph.core.dot.DotAttributes;
import com.flowgraph.core.dot.DotWriter;
import com.flowgraph.core.dot.Edge;
import com.flowgraph.core.dot.GraphSetBuilder;
import com.flowgraph.core.dot.Node;
import com.flowgraph.core.generator.DiagramCategory;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.generator.Palette;
import com.flowgraph.core.generator.ScopeKey;
import com.flowgraph.core.model.ProcessKey;
import com.flowgraph.core.source.EnergySystemQuery;

import java.util.List;
import java.util.Optional;

/**
 * Draws one node per technology and carrier, collapsing periods and vintages.
 *
 * <p>This is the entry point of the image set: technologies link to their process
 * diagram and carriers to their commodity diagram.
 */
public class SystemOverviewGenerator extends AbstractDiagramGenerator {

    public static final String ID = "system-overview";

    public SystemOverviewGenerator() {
        super(ID, "System Overview", DiagramCategory.SYSTEM);
    }

    @Override
    public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
        return List.of(ScopeKey.whole(ID));
    }

    @Override
    protected Optional<GeneratedDiagram> draw(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        if (query.activeProcesses().isEmpty()) {
            return Optional.empty();
        }

        GraphSetBuilder<Node> techs = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> carriers = GraphSetBuilder.nodes();
        GraphSetBuilder<Edge> inputs = GraphSetBuilder.edges();
        GraphSetBuilder<Edge> outputs = GraphSetBuilder.edges();

        for (ProcessKey process : query.activeProcesses()) {
            String tech = process.tech();
            techs.addNode(tech, href(link(DiagramCategory.PROCESSES, DiagramNames.process(tech), settings)));
            for (String input : query.processInputs(process)) {
                carriers.addNode(input, carrierLink(input, settings));
                for (String output : query.processOutputsByInput(process, input)) {
                    carriers.addNode(output, carrierLink(output, settings));
                    inputs.addEdge(input, tech);
                    outputs.addEdge(tech, output);
                }
            }
        }

        Palette palette = settings.palette();
        DotWriter dot = newDocument(DiagramNames.SIMPLE_MODEL, "the energy system by technology", settings)
            .beginStrictDigraph("model")
            .graphAttribute("rankdir", "LR")
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("style", "filled"))
            .edgeDefaults(DotAttributes.create().add("arrowhead", "vee").add("labelfontcolor", "lightgreen"))
            .blankLine()
            .beginSubgraph("techs")
            .nodeDefaults(DotAttributes.create().add("color", palette.techColor()).add("shape", "box"))
            .blankLine()
            .nodes(techs)
            .end()
            .blankLine()
            .beginSubgraph("energy_carriers")
            .nodeDefaults(DotAttributes.create().add("color", palette.commodityColor()).add("shape", "circle"))
            .blankLine()
            .nodes(carriers)
            .end()
            .blankLine()
            .beginSubgraph("inputs")
            .edgeDefaults(DotAttributes.create().add("color", palette.inputArrowColor()))
            .blankLine()
            .edges(inputs)
            .end()
            .blankLine()
            .beginSubgraph("outputs")
            .edgeDefaults(DotAttributes.create().add("color", palette.outputArrowColor()))
            .blankLine()
            .edges(outputs)
            .end()
            .end();
        return diagram(DiagramNames.SIMPLE_MODEL, dot);
    }

    private DotAttributes carrierLink(String carrier, DiagramSettings settings) {
        return href(link(DiagramCategory.COMMODITIES, DiagramNames.commodity(carrier), settings));
    }
}
