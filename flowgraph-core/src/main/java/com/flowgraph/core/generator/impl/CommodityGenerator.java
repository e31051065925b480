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

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Draws the technologies that consume and produce one energy carrier.
 */
public class CommodityGenerator extends AbstractDiagramGenerator {

    public static final String ID = "commodity";

    static final String COMMODITY = "commodity";

    public CommodityGenerator() {
        super(ID, "Commodity Flows", DiagramCategory.COMMODITIES);
    }

    /**
     * One scope per carrier that is an input or output of an active process.
     */
    @Override
    public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
        SortedSet<String> carriers = new TreeSet<>();
        for (ProcessKey process : query.activeProcesses()) {
            carriers.addAll(query.processInputs(process));
            carriers.addAll(query.processOutputs(process));
        }
        return carriers.stream().map(c -> ScopeKey.of(ID, COMMODITY, c)).toList();
    }

    @Override
    protected Optional<GeneratedDiagram> draw(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        String carrier = scope.get(COMMODITY);
        SortedSet<TechVintage> consumers = query.processesByInput(carrier);
        SortedSet<TechVintage> producers = query.processesByOutput(carrier);
        if (consumers.isEmpty() && producers.isEmpty()) {
            return Optional.empty();
        }

        GraphSetBuilder<Node> techs = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> carriers = GraphSetBuilder.nodes();
        GraphSetBuilder<Edge> inputs = GraphSetBuilder.edges();
        GraphSetBuilder<Edge> outputs = GraphSetBuilder.edges();

        carriers.addNode(carrier, href(link(DiagramCategory.SYSTEM, DiagramNames.SIMPLE_MODEL, settings)));
        for (TechVintage consumer : consumers) {
            techs.addNode(consumer.tech(), processLink(consumer.tech(), settings));
            inputs.addEdge(carrier, consumer.tech());
        }
        for (TechVintage producer : producers) {
            techs.addNode(producer.tech(), processLink(producer.tech(), settings));
            outputs.addEdge(producer.tech(), carrier);
        }

        Palette palette = settings.palette();
        String name = DiagramNames.commodity(carrier);
        DotWriter dot = newDocument(name, "the flow of energy via the carrier '" + carrier + "'", settings)
            .beginStrictDigraph("energy_carrier")
            .graphAttribute("label", carrier)
            .blankLine()
            .graphAttribute("color", "black")
            .graphAttribute("compound", "True")
            .graphAttribute("concentrate", "True")
            .graphAttribute("rankdir", "LR")
            .graphAttribute("splines", settings.splines())
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("style", "filled"))
            .edgeDefaults(DotAttributes.create()
                .add("arrowhead", "vee")
                .add("fontsize", "8")
                .add("label", SPACER_LABEL)
                .add("labelfloat", "false")
                .add("len", "2")
                .add("weight", "0.5"))
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
            .beginSubgraph("outputs")
            .edgeDefaults(DotAttributes.create().add("color", palette.outputArrowColor()))
            .blankLine()
            .edges(outputs)
            .end()
            .blankLine()
            .beginSubgraph("inputs")
            .edgeDefaults(DotAttributes.create().add("color", palette.inputArrowColor()))
            .blankLine()
            .edges(inputs)
            .end()
            .end();
        return diagram(name, dot);
    }

    private DotAttributes processLink(String tech, DiagramSettings settings) {
        return href(link(DiagramCategory.PROCESSES, DiagramNames.process(tech), settings));
    }
}
