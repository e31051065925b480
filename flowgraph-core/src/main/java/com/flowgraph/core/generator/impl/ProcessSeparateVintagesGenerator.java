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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Draws one technology as two clusters, its vintages and the periods they operate in.
 *
 * <p>Each vintage-to-period edge takes the next colour of the palette's rainbow so that
 * crossing connections stay distinguishable. Carrier edges attach to the middle vintage
 * and the middle period, and are clipped at the cluster border.
 */
public class ProcessSeparateVintagesGenerator extends AbstractDiagramGenerator {

    public static final String ID = "process-separate-vintages";

    static final String TECH = "tech";

    public ProcessSeparateVintagesGenerator() {
        super(ID, "Process (separate vintages)", DiagramCategory.PROCESSES);
    }

    @Override
    public boolean appliesTo(DiagramSettings settings) {
        return settings.processLayout() == ProcessLayout.SEPARATE_VINTAGES;
    }

    @Override
    public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
        return query.technologies().stream().map(t -> ScopeKey.of(ID, TECH, t)).toList();
    }

    @Override
    protected Optional<GeneratedDiagram> draw(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        String tech = scope.get(TECH);

        List<ProcessKey> processes = new ArrayList<>();
        SortedSet<Integer> periods = new TreeSet<>();
        SortedSet<Integer> vintages = new TreeSet<>();
        for (ProcessKey process : query.activeProcesses()) {
            if (process.tech().equals(tech)) {
                processes.add(process);
                periods.add(process.period());
                vintages.add(process.vintage());
            }
        }
        if (processes.isEmpty()) {
            // declared but never given an efficiency
            return Optional.empty();
        }

        String midPeriod = periodNode(middle(periods));
        String midVintage = vintageNode(middle(vintages));

        Palette palette = settings.palette();
        List<String> rainbow = palette.rainbow();

        GraphSetBuilder<Node> inputNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> outputNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> periodNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> vintageNodes = GraphSetBuilder.nodes();
        GraphSetBuilder<Edge> externalEdges = GraphSetBuilder.edges();
        GraphSetBuilder<Edge> vintageEdges = GraphSetBuilder.edges();

        DotAttributes intoCluster = DotAttributes.create()
            .add("color", palette.inputArrowColor())
            .add("lhead", "cluster_vintage");
        DotAttributes outOfCluster = DotAttributes.create()
            .add("color", palette.outputArrowColor())
            .add("ltail", "cluster_period");

        int colour = 0;
        for (ProcessKey process : processes) {
            String periodNode = periodNode(process.period());
            String vintageNode = vintageNode(process.vintage());
            if (settings.showCapacity()) {
                double periodCapacity = query.periodCapacity(process.period(), tech).orElse(0.0);
                double vintageCapacity = query.capacity(tech, process.vintage()).orElse(0.0);
                periodNodes.addNode(periodNode, DotAttributes.create()
                    .add("label", "p" + process.period() + "\\nTotal Capacity: " + format(periodCapacity)));
                vintageNodes.addNode(vintageNode, DotAttributes.create()
                    .add("label", "v" + process.vintage() + "\\nCapacity: " + format(vintageCapacity)));
            } else {
                periodNodes.addNode(periodNode);
                vintageNodes.addNode(vintageNode);
            }

            for (String input : query.processInputs(process)) {
                for (String output : query.processOutputsByInput(process, input)) {
                    String edgeColour = rainbow.get(colour);
                    colour = (colour + 1) % rainbow.size();

                    inputNodes.addNode(input, DotAttributes.create()
                        .add("color", palette.incomingCommodityColor())
                        .add("href", commodityLink(input, settings)));
                    outputNodes.addNode(output, DotAttributes.create()
                        .add("color", palette.outgoingCommodityColor())
                        .add("href", commodityLink(output, settings)));
                    externalEdges.addEdge(input, midVintage, intoCluster);
                    vintageEdges.addEdge(vintageNode, periodNode, DotAttributes.create().add("color", edgeColour));
                    externalEdges.addEdge(midPeriod, output, outOfCluster);
                }
            }
        }

        String overview = link(DiagramCategory.SYSTEM, DiagramNames.SIMPLE_MODEL, settings);
        String name = DiagramNames.process(tech);
        DotWriter dot = newDocument(name, "the vintages and periods of technology '" + tech + "'", settings)
            .beginStrictDigraph("model")
            .graphAttribute("label", tech)
            .blankLine()
            .graphAttribute("bgcolor", "transparent")
            .graphAttribute("color", "black")
            .graphAttribute("compound", "True")
            .graphAttribute("concentrate", "True")
            .graphAttribute("rankdir", "LR")
            .graphAttribute("splines", settings.splines())
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("shape", "box").add("style", "filled"))
            .blankLine()
            .edgeDefaults(DotAttributes.create()
                .add("arrowhead", "vee")
                .add("decorate", "True")
                .add("dir", "both")
                .add("fontsize", "8")
                .add("label", SPACER_LABEL)
                .add("labelfloat", "false")
                .add("labelfontcolor", "lightgreen")
                .add("len", "2")
                .add("weight", "0.5"))
            .blankLine();

        cluster(dot, "cluster_vintage", "Vintages", overview, palette).nodes(vintageNodes).end().blankLine();
        cluster(dot, "cluster_period", "Period", overview, palette).nodes(periodNodes).end().blankLine();

        dot.beginSubgraph("energy_carriers")
            .nodeDefaults(DotAttributes.create().add("shape", "circle"))
            .blankLine()
            .comment("Input carriers")
            .nodes(inputNodes)
            .blankLine()
            .comment("Output carriers")
            .nodes(outputNodes)
            .end()
            .blankLine()
            .beginSubgraph("external_edges")
            .edgeDefaults(DotAttributes.create().add("arrowhead", "normal").add("dir", "forward"))
            .blankLine()
            .edges(externalEdges)
            .end()
            .blankLine()
            .beginSubgraph("internal_edges")
            .comment("edges between vintages and periods")
            .edges(vintageEdges)
            .end()
            .end();
        return diagram(name, dot);
    }

    private static DotWriter cluster(DotWriter dot, String name, String label, String href, Palette palette) {
        return dot.beginSubgraph(name)
            .graphAttribute("label", label)
            .blankLine()
            .graphAttribute("color", palette.clusterColor())
            .graphAttribute("style", "filled")
            .graphAttribute("href", href)
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("color", palette.clusterNodeColor()))
            .blankLine();
    }

    private String commodityLink(String carrier, DiagramSettings settings) {
        return link(DiagramCategory.COMMODITIES, DiagramNames.commodity(carrier), settings);
    }

    private static int middle(SortedSet<Integer> values) {
        return new ArrayList<>(values).get(values.size() / 2);
    }

    private static String periodNode(int period) {
        return "p_" + period;
    }

    private static String vintageNode(int vintage) {
        return "v_" + vintage;
    }
}
