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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Draws how the activity of one process splits over the time slices of a period.
 *
 * <p>Each {@code season, time of day} slice with a non-zero input flow becomes a node;
 * all input/output pairs of the process share the slice nodes.
 */
public class FlowSegmentsGenerator extends AbstractDiagramGenerator {

    public static final String ID = "flow-segments";

    static final String TECH = "tech";
    static final String PERIOD = "period";
    static final String VINTAGE = "vintage";

    public FlowSegmentsGenerator() {
        super(ID, "Flow Segments", DiagramCategory.RESULTS);
    }

    /**
     * One scope per process with activity in a period with reported capacity.
     */
    @Override
    public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
        List<ScopeKey> scopes = new ArrayList<>();
        for (ProcessKey key : query.periodCapacityKeys()) {
            for (int vintage : query.processVintages(key.period(), key.tech())) {
                if (query.vintageActivity(new ProcessKey(key.period(), key.tech(), vintage)) != 0) {
                    scopes.add(ScopeKey.of(ID, TECH, key.tech(), PERIOD, key.period(), VINTAGE, vintage));
                }
            }
        }
        return scopes;
    }

    @Override
    protected Optional<GeneratedDiagram> draw(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        String tech = scope.get(TECH);
        int period = scope.getInt(PERIOD);
        int vintage = scope.getInt(VINTAGE);
        ProcessKey process = new ProcessKey(period, tech, vintage);

        GraphSetBuilder<Node> slices = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> carriers = GraphSetBuilder.nodes();
        GraphSetBuilder<Edge> inputs = GraphSetBuilder.edges();
        GraphSetBuilder<Edge> outputs = GraphSetBuilder.edges();

        for (String input : query.processInputs(process)) {
            for (String output : query.processOutputsByInput(process, input)) {
                for (String season : query.seasons()) {
                    for (String timeOfDay : query.timesOfDay()) {
                        double flowIn = query.flowIn(process, season, timeOfDay, input, output);
                        if (flowIn == 0) {
                            continue;
                        }
                        double flowOut = query.flowOut(process, season, timeOfDay, input, output);
                        String slice = season + ", " + timeOfDay;
                        slices.addNode(slice);
                        carriers.addNode(input, carrierLink(input, period, settings));
                        carriers.addNode(output, carrierLink(output, period, settings));
                        inputs.addEdge(input, slice, flowLabel(flowIn));
                        outputs.addEdge(slice, output, flowLabel(flowOut));
                    }
                }
            }
        }
        if (slices.isEmpty()) {
            return Optional.empty();
        }

        Palette palette = settings.palette();
        // Labelled with the period total for the tech, not the vintage's own capacity
        double capacity = query.periodCapacity(period, tech).orElse(0.0);
        String name = DiagramNames.flowSegments(tech, period, vintage);
        DotWriter dot = newDocument(name, "the activity split of process " + tech + ", " + vintage + " in " + period, settings)
            .beginStrictDigraph("model")
            .graphAttribute("label", "Activity split of process " + tech + ", " + vintage + " in year " + period)
            .blankLine()
            .graphAttribute("compound", "True")
            .graphAttribute("concentrate", "True")
            .graphAttribute("rankdir", "LR")
            .graphAttribute("splines", settings.splines())
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("style", "filled"))
            .edgeDefaults(DotAttributes.create().add("arrowhead", "vee"))
            .blankLine()
            .beginSubgraph("cluster_slices")
            .graphAttribute("label", vintage + " Capacity: " + format(capacity))
            .blankLine()
            .graphAttribute("color", palette.clusterColor())
            .graphAttribute("rank", "same")
            .graphAttribute("style", "filled")
            .graphAttribute("href", link(DiagramCategory.RESULTS, DiagramNames.techResults(tech, period), settings))
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("color", palette.clusterNodeColor()).add("shape", "box"))
            .blankLine()
            .nodes(slices)
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
