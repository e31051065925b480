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
import com.flowgraph.core.generator.ProcessLayout;
import com.flowgraph.core.generator.ScopeKey;
import com.flowgraph.core.model.ProcessKey;
import com.flowgraph.core.source.EnergySystemQuery;

import java.util.List;
import java.util.Optional;

/**
 * Draws one technology with a node per {@code (period, vintage)} pair, e.g.
 * {@code p2010_v2000}, and an explicit edge for every input and output.
 */
public class ProcessExplicitVintagesGenerator extends AbstractDiagramGenerator {

    public static final String ID = "process-explicit-vintages";

    static final String TECH = "tech";

    public ProcessExplicitVintagesGenerator() {
        super(ID, "Process (explicit vintages)", DiagramCategory.PROCESSES);
    }

    @Override
    public boolean appliesTo(DiagramSettings settings) {
        return settings.processLayout() == ProcessLayout.EXPLICIT_VINTAGES;
    }

    @Override
    public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
        return query.technologies().stream().map(t -> ScopeKey.of(ID, TECH, t)).toList();
    }

    @Override
    protected Optional<GeneratedDiagram> draw(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        String tech = scope.get(TECH);
        Palette palette = settings.palette();
        String overview = link(DiagramCategory.SYSTEM, DiagramNames.SIMPLE_MODEL, settings);

        GraphSetBuilder<Node> inputNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> outputNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> vintageNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Edge> edges = GraphSetBuilder.edges();

        for (ProcessKey process : query.activeProcesses()) {
            if (!process.tech().equals(tech)) {
                continue;
            }
            String node = "p" + process.period() + "_v" + process.vintage();
            DotAttributes nodeAttributes = DotAttributes.create().add("color", palette.techColor());
            if (settings.showCapacity()) {
                double capacity = query.capacity(tech, process.vintage()).orElse(0.0);
                nodeAttributes.add("label", node + "\\nCapacity = " + format(capacity));
            }
            nodeAttributes.add("href", overview);

            for (String input : query.processInputs(process)) {
                for (String output : query.processOutputsByInput(process, input)) {
                    inputNodes.addNode(input, carrierAttributes(input, settings));
                    outputNodes.addNode(output, carrierAttributes(output, settings));
                    vintageNodes.addNode(node, nodeAttributes);
                    edges.addEdge(input, node, DotAttributes.create()
                        .add("color", palette.inputArrowColor())
                        .add("sametail", input));
                    edges.addEdge(node, output, DotAttributes.create()
                        .add("color", palette.outputArrowColor())
                        .add("samehead", output));
                }
            }
        }
        if (vintageNodes.isEmpty()) {
            // declared but never given an efficiency
            return Optional.empty();
        }

        String name = DiagramNames.process(tech);
        DotWriter dot = newDocument(name, "the process vintages of technology '" + tech + "'", settings)
            .beginStrictDigraph("model")
            .graphAttribute("label", tech)
            .blankLine()
            .graphAttribute("color", "black")
            .graphAttribute("concentrate", "True")
            .graphAttribute("rankdir", "LR")
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("shape", "box").add("style", "filled"))
            .blankLine()
            .edgeDefaults(DotAttributes.create()
                .add("arrowhead", "vee")
                .add("decorate", "True")
                .add("label", SPACER_LABEL)
                .add("labelfontcolor", "lightgreen"))
            .blankLine()
            .beginSubgraph("energy_carriers")
            .nodeDefaults(DotAttributes.create().add("shape", "circle"))
            .blankLine()
            .comment("Input carriers")
            .nodes(inputNodes)
            .blankLine()
            .comment("Output carriers")
            .nodes(outputNodes)
            .end()
            .blankLine()
            .comment("Vintage nodes")
            .nodes(vintageNodes)
            .blankLine()
            .edges(edges)
            .end();
        return diagram(name, dot);
    }

    private DotAttributes carrierAttributes(String carrier, DiagramSettings settings) {
        return DotAttributes.create()
            .add("color", settings.palette().commodityColor())
            .add("href", link(DiagramCategory.COMMODITIES, DiagramNames.commodity(carrier), settings));
    }
}
