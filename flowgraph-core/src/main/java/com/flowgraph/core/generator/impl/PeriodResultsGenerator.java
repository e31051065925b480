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
import com.flowgraph.core.model.EmissionActivity;
import com.flowgraph.core.model.ProcessKey;
import com.flowgraph.core.source.EnergySystemQuery;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Draws the solved energy system for one optimized period.
 *
 * <p>Technologies with available capacity, carriers and emissions are split into used
 * and unused groups. Flows at or above the threshold are drawn in colour and labelled
 * with their magnitude; the rest are drawn in the unused colour without a label.
 */
public class PeriodResultsGenerator extends AbstractDiagramGenerator {

    public static final String ID = "period-results";

    static final String PERIOD = "period";

    public PeriodResultsGenerator() {
        super(ID, "Period Results", DiagramCategory.RESULTS);
    }

    @Override
    public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
        if (!query.hasResults()) {
            return List.of();
        }
        return query.optimizePeriods().stream().map(p -> ScopeKey.of(ID, PERIOD, p)).toList();
    }

    @Override
    protected Optional<GeneratedDiagram> draw(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        int period = scope.getInt(PERIOD);

        GraphSetBuilder<Node> usedTechs = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> unusedTechs = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> usedCarriers = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> unusedCarriers = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> usedEmissions = GraphSetBuilder.nodes();
        GraphSetBuilder<Node> unusedEmissions = GraphSetBuilder.nodes();
        GraphSetBuilder<Edge> inputFlows = GraphSetBuilder.edges();
        GraphSetBuilder<Edge> outputFlows = GraphSetBuilder.edges();
        GraphSetBuilder<Edge> unusedFlows = GraphSetBuilder.edges();
        Set<String> carriersInUse = new HashSet<>();
        Set<String> emissionsInUse = new HashSet<>();

        for (String tech : query.technologies()) {
            OptionalDouble capacity = query.periodCapacity(period, tech);
            if (capacity.isEmpty()) {
                continue;
            }
            if (capacity.getAsDouble() > 0) {
                usedTechs.addNode(tech, DotAttributes.create()
                    .add("label", tech + "\\nCapacity: " + format(capacity.getAsDouble()))
                    .add("href", link(DiagramCategory.RESULTS, DiagramNames.techResults(tech, period), settings)));
            } else {
                unusedTechs.addNode(tech);
            }

            for (int vintage : query.processVintages(period, tech)) {
                ProcessKey process = new ProcessKey(period, tech, vintage);
                for (String input : query.processInputs(process)) {
                    double consumed = query.energyConsumption(period, input, tech);
                    if (settings.isSignificant(consumed)) {
                        inputFlows.addEdge(input, tech, flowLabel(consumed));
                        usedCarriers.addNode(input, carrierLink(input, period, settings));
                        carriersInUse.add(input);
                    } else {
                        unusedFlows.addEdge(input, tech);
                    }
                }
                for (String output : query.processOutputs(process)) {
                    double produced = query.energyProduction(period, tech, output);
                    if (settings.isSignificant(produced)) {
                        outputFlows.addEdge(tech, output, flowLabel(produced));
                        usedCarriers.addNode(output, carrierLink(output, period, settings));
                        carriersInUse.add(output);
                    } else {
                        unusedFlows.addEdge(tech, output);
                    }
                }
            }
        }

        for (EmissionActivity activity : query.emissionActivities()) {
            if (!query.isActive(new ProcessKey(period, activity.tech(), activity.vintage()))) {
                continue;
            }
            double amount = query.emissionTotal(activity.emission(), period, activity.tech());
            if (!settings.isSignificant(amount)) {
                continue;
            }
            outputFlows.addEdge(activity.tech(), activity.emission(), flowLabel(amount));
            usedEmissions.addNode(activity.emission());
            emissionsInUse.add(activity.emission());
        }

        if (usedTechs.isEmpty() && unusedTechs.isEmpty()) {
            return Optional.empty();
        }

        query.carriers().stream().filter(c -> !carriersInUse.contains(c)).forEach(unusedCarriers::addNode);
        query.emissions().stream().filter(e -> !emissionsInUse.contains(e)).forEach(unusedEmissions::addNode);

        Palette palette = settings.palette();
        DotAttributes unusedBox = groupDefaults(palette.unusedColor(), palette.unusedFontColor(), "box");
        DotAttributes unusedCircle = groupDefaults(palette.unusedColor(), palette.unusedFontColor(), "circle");
        DotAttributes usedBox = groupDefaults(palette.techColor(), palette.usedFontColor(), "box");
        DotAttributes usedCircle = groupDefaults(palette.commodityColor(), palette.usedFontColor(), "circle");

        String name = DiagramNames.periodResults(period);
        DotWriter dot = newDocument(name, "the results for period " + period, settings)
            .beginStrictDigraph("model")
            .graphAttribute("label", "Results for " + period)
            .blankLine()
            .graphAttribute("rankdir", "LR")
            .graphAttribute("smoothtype", "power_dist")
            .graphAttribute("splines", settings.splines())
            .blankLine()
            .nodeDefaults(DotAttributes.create().add("style", "filled"))
            .edgeDefaults(DotAttributes.create().add("arrowhead", "vee"))
            .blankLine();
        group(dot, "unused_techs", unusedBox, unusedTechs);
        group(dot, "unused_energy_carriers", unusedCircle, unusedCarriers);
        group(dot, "unused_emissions", unusedCircle, unusedEmissions);
        group(dot, "in_use_techs", usedBox, usedTechs);
        group(dot, "in_use_energy_carriers", usedCircle, usedCarriers);
        group(dot, "in_use_emissions", usedCircle, usedEmissions);
        dot.beginSubgraph("unused_flows")
            .edgeDefaults(DotAttributes.create().add("color", palette.unusedColor()))
            .blankLine()
            .edges(unusedFlows)
            .end()
            .blankLine()
            .beginSubgraph("in_use_flows")
            .beginSubgraph("inputs")
            .edgeDefaults(DotAttributes.create().add("color", palette.inputArrowColor()))
            .blankLine()
            .edges(inputFlows)
            .end()
            .blankLine()
            .beginSubgraph("outputs")
            .edgeDefaults(DotAttributes.create().add("color", palette.outputArrowColor()))
            .blankLine()
            .edges(outputFlows)
            .end()
            .end()
            .end();
        return diagram(name, dot);
    }

    private DotAttributes carrierLink(String carrier, int period, DiagramSettings settings) {
        return href(link(DiagramCategory.COMMODITIES, DiagramNames.commodityResults(carrier, period), settings));
    }

    private static DotAttributes groupDefaults(String color, String fontColor, String shape) {
        return DotAttributes.create()
            .add("color", color)
            .add("fontcolor", fontColor)
            .add("shape", shape);
    }

    private static void group(DotWriter dot, String name, DotAttributes defaults, GraphSetBuilder<Node> nodes) {
        dot.beginSubgraph(name)
            .nodeDefaults(defaults)
            .blankLine()
            .nodes(nodes)
            .end()
            .blankLine();
    }
}
