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
 * Draws every active process as its own node, labelled {@code period, tech, vintage},
 * with all of its input and output carriers.
 *
 * <p>Only usable for small systems; larger ones are better explored through the
 * overview and per-carrier diagrams.
 */
public class CompleteSystemGenerator extends AbstractDiagramGenerator {

    public static final String ID = "complete-system";

    public CompleteSystemGenerator() {
        super(ID, "Complete Energy System", DiagramCategory.SYSTEM);
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
            String label = process.period() + ", " + process.tech() + ", " + process.vintage();
            techs.addNode(label);
            for (String input : query.processInputs(process)) {
                carriers.addNode(input);
                inputs.addEdge(input, label);
            }
            for (String output : query.processOutputs(process)) {
                carriers.addNode(output);
                outputs.addEdge(label, output);
            }
        }

        Palette palette = settings.palette();
        DotWriter dot = newDocument(DiagramNames.ALL_VINTAGES_MODEL, "every active process of the energy system", settings)
            .beginStrictDigraph("EnergySystem")
            .graphAttribute("rankdir", "LR")
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("style", "filled"))
            .edgeDefaults(DotAttributes.create().add("arrowhead", "vee").add("label", SPACER_LABEL))
            .blankLine()
            .beginSubgraph("technologies")
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
        return diagram(DiagramNames.ALL_VINTAGES_MODEL, dot);
    }
}
