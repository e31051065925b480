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
import com.flowgraph.core.model.TechVintage;
import com.flowgraph.core.source.EnergySystemQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Draws the technologies around one carrier in one period, split into technologies that
 * carry flow anywhere in the solution and technologies that never do.
 */
public class CommodityResultsGenerator extends AbstractDiagramGenerator {

    public static final String ID = "commodity-results";

    static final String COMMODITY = "commodity";
    static final String PERIOD = "period";

    public CommodityResultsGenerator() {
        super(ID, "Commodity Results", DiagramCategory.COMMODITIES);
    }

    /**
     * One scope per used carrier and horizon period.
     */
    @Override
    public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
        if (!query.hasResults()) {
            return List.of();
        }
        Usage usage = Usage.of(query, settings);
        List<ScopeKey> scopes = new ArrayList<>();
        for (int period : query.periods()) {
            for (String carrier : usage.carriers()) {
                scopes.add(ScopeKey.of(ID, COMMODITY, carrier, PERIOD, period));
            }
        }
        return scopes;
    }

    @Override
    protected Optional<GeneratedDiagram> draw(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        String carrier = scope.get(COMMODITY);
        int period = scope.getInt(PERIOD);
        Usage usage = Usage.of(query, settings);

        GraphSetBuilder<Node> carrierNode = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> usedNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> unusedNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Edge> usedEdges = GraphSetBuilder.edges();
        GraphSetBuilder<Edge> unusedEdges = GraphSetBuilder.edges();

        Palette palette = settings.palette();
        carrierNode.addNode(carrier, DotAttributes.create()
            .add("color", palette.commodityColor())
            .add("href", link(DiagramCategory.RESULTS, DiagramNames.periodResults(period), settings))
            .add("shape", "circle"));

        for (TechVintage consumer : query.processesByInput(carrier)) {
            String tech = consumer.tech();
            if (usage.techs().contains(tech)) {
                usedNodes.addNode(tech, techLink(tech, period, settings));
                usedEdges.addEdge(carrier, tech);
            } else {
                unusedNodes.addNode(tech);
                unusedEdges.addEdge(carrier, tech);
            }
        }
        for (TechVintage producer : query.processesByOutput(carrier)) {
            String tech = producer.tech();
            if (usage.techs().contains(tech)) {
                usedNodes.addNode(tech, techLink(tech, period, settings));
                usedEdges.addEdge(tech, carrier);
            } else {
                unusedNodes.addNode(tech);
                unusedEdges.addEdge(tech, carrier);
            }
        }
        if (usedNodes.isEmpty() && unusedNodes.isEmpty()) {
            return Optional.empty();
        }

        String name = DiagramNames.commodityResults(carrier, period);
        DotWriter dot = newDocument(name, "the results for carrier '" + carrier + "' in " + period, settings)
            .beginStrictDigraph("result_commodity_" + carrier)
            .graphAttribute("label", carrier + " - " + period)
            .blankLine()
            .graphAttribute("compound", "True")
            .graphAttribute("concentrate", "True")
            .graphAttribute("rankdir", "LR")
            .graphAttribute("splines", settings.splines())
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("shape", "box").add("style", "filled"))
            .edgeDefaults(DotAttributes.create()
                .add("arrowhead", "vee")
                .add("fontsize", "8")
                .add("label", SPACER_LABEL)
                .add("labelfloat", "False")
                .add("labelfontcolor", "lightgreen")
                .add("len", "2")
                .add("weight", "0.5"))
            .blankLine()
            .nodes(carrierNode)
            .blankLine()
            .beginSubgraph("used_techs")
            .nodeDefaults(DotAttributes.create().add("color", palette.techColor()))
            .blankLine()
            .nodes(usedNodes)
            .end()
            .blankLine()
            .beginSubgraph("unused_techs")
            .nodeDefaults(DotAttributes.create().add("color", palette.unusedColor()))
            .blankLine()
            .nodes(unusedNodes)
            .end()
            .blankLine()
            .beginSubgraph("in_use_flows")
            .edgeDefaults(DotAttributes.create().add("color", palette.usedFlowColor()))
            .blankLine()
            .edges(usedEdges)
            .end()
            .blankLine()
            .beginSubgraph("unused_flows")
            .edgeDefaults(DotAttributes.create().add("color", palette.unusedColor()))
            .blankLine()
            .edges(unusedEdges)
            .end()
            .end();
        return diagram(name, dot);
    }

    private DotAttributes techLink(String tech, int period, DiagramSettings settings) {
        return href(link(DiagramCategory.RESULTS, DiagramNames.techResults(tech, period), settings));
    }

    /**
     * Carriers and technologies touched by at least one significant flow in any period.
     */
    record Usage(SortedSet<String> carriers, SortedSet<String> techs) {

        static Usage of(EnergySystemQuery query, DiagramSettings settings) {
            SortedSet<String> carriers = new TreeSet<>();
            SortedSet<String> techs = new TreeSet<>();
            for (ProcessKey process : query.activeProcesses()) {
                for (String input : query.processInputs(process)) {
                    for (String output : query.processOutputsByInput(process, input)) {
                        if (settings.isSignificant(query.totalFlowIn(process, input, output))) {
                            carriers.addAll(query.processInputs(process));
                            carriers.addAll(query.processOutputs(process));
                            techs.add(process.tech());
                        }
                    }
                }
            }
            return new Usage(carriers, techs);
        }
    }
}
