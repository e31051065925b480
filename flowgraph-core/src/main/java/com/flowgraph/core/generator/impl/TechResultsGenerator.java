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
 * Draws the vintages of one technology that are active in a period, with their
 * capacities and the flows summed over all time slices.
 */
public class TechResultsGenerator extends AbstractDiagramGenerator {

    public static final String ID = "tech-results";

    static final String TECH = "tech";
    static final String PERIOD = "period";

    public TechResultsGenerator() {
        super(ID, "Technology Results", DiagramCategory.RESULTS);
    }

    /**
     * One scope per {@code (period, tech)} pair with reported available capacity.
     */
    @Override
    public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
        return query.periodCapacityKeys().stream()
            .map(k -> ScopeKey.of(ID, TECH, k.tech(), PERIOD, k.period()))
            .toList();
    }

    @Override
    protected Optional<GeneratedDiagram> draw(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        String tech = scope.get(TECH);
        int period = scope.getInt(PERIOD);
        double totalCapacity = query.periodCapacity(period, tech).orElse(0.0);

        GraphSetBuilder<Node> vintageNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> carriers = GraphSetBuilder.nodes();
        GraphSetBuilder<Edge> inputs = GraphSetBuilder.edges();
        GraphSetBuilder<Edge> outputs = GraphSetBuilder.edges();

        for (int vintage : query.processVintages(period, tech)) {
            ProcessKey process = new ProcessKey(period, tech, vintage);
            if (query.vintageActivity(process) == 0) {
                continue;
            }

            String node = String.valueOf(vintage);
            double capacity = query.capacity(tech, vintage).orElse(0.0);
            for (String input : query.processInputs(process)) {
                for (String output : query.processOutputsByInput(process, input)) {
                    vintageNodes.addNode(node, DotAttributes.create()
                        .add("href", link(DiagramCategory.RESULTS, DiagramNames.flowSegments(tech, period, vintage), settings))
                        .add("label", vintage + "\\nCap: " + format(capacity)));
                    carriers.addNode(input, carrierLink(input, period, settings));
                    carriers.addNode(output, carrierLink(output, period, settings));
                    inputs.addEdge(input, node, flowLabel(query.totalFlowIn(process, input, output)));
                    outputs.addEdge(node, output, flowLabel(query.totalFlowOut(process, input, output)));
                }
            }
        }
        if (vintageNodes.isEmpty()) {
            return Optional.empty();
        }

        Palette palette = settings.palette();
        String name = DiagramNames.techResults(tech, period);
        DotWriter dot = newDocument(name, "the results for technology '" + tech + "' in " + period, settings)
            .beginStrictDigraph("model")
            .graphAttribute("label", "Results for " + tech + " in " + period)
            .blankLine()
            .graphAttribute("compound", "True")
            .graphAttribute("concentrate", "True")
            .graphAttribute("rankdir", "LR")
            .graphAttribute("splines", settings.splines())
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("style", "filled"))
            .edgeDefaults(DotAttributes.create().add("arrowhead", "vee"))
            .blankLine()
            .beginSubgraph("cluster_vintages")
            .graphAttribute("label", "Vintages\\nCapacity: " + format(totalCapacity))
            .blankLine()
            .graphAttribute("href", link(DiagramCategory.RESULTS, DiagramNames.periodResults(period), settings))
            .graphAttribute("style", "filled")
            .graphAttribute("color", palette.clusterColor())
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("color", palette.clusterNodeColor()).add("shape", "box"))
            .blankLine()
            .nodes(vintageNodes)
            .end()
            .blankLine()
            .beginSubgraph("energy_carriers")
            .nodeDefaults(DotAttributes.create()
                .add("color", palette.commodityColor())
                .add("fontcolor", palette.usedFontColor())
                .add("shape", "circle"))
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
        return diagram(name, dot);
    }

    private DotAttributes carrierLink(String carrier, int period, DiagramSettings settings) {
        return href(link(DiagramCategory.COMMODITIES, DiagramNames.commodityResults(carrier, period), settings));
    }
}
