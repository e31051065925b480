package com.flowgraph.core.source;

import com.flowgraph.core.model.Efficiency;
import com.flowgraph.core.model.EnergySystem;
import com.flowgraph.core.model.ProcessKey;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a dataset for references to undeclared set members.
 *
 * <p>Findings are warnings: diagrams can still be drawn, but undeclared members will not
 * appear in the "unused" sections of the result diagrams.
 */
public final class ModelValidator {

    private ModelValidator() {
        // Utility class
    }

    /**
     * Validates a dataset.
     *
     * @param system dataset
     * @return human-readable problems, empty if none
     */
    public static List<String> validate(EnergySystem system) {
        Set<String> problems = new LinkedHashSet<>();
        Set<String> techs = new HashSet<>(system.technologies());
        Set<String> commodities = new HashSet<>(system.carriers());
        commodities.addAll(system.emissions());
        Set<Integer> periods = new HashSet<>(system.periods());
        Set<String> networkTechs = new HashSet<>();

        for (Efficiency eff : system.efficiencies()) {
            networkTechs.add(eff.tech());
            if (!techs.contains(eff.tech())) {
                problems.add("Efficiency references undeclared technology: " + eff.tech());
            }
            for (String carrier : List.of(eff.input(), eff.output())) {
                if (!commodities.contains(carrier)) {
                    problems.add("Efficiency references undeclared carrier: " + carrier);
                }
            }
        }

        for (ProcessKey process : system.processes()) {
            if (!periods.contains(process.period())) {
                problems.add("Process references undeclared period: " + process.period());
            }
            if (!networkTechs.contains(process.tech())) {
                problems.add("Process has no efficiency data: " + process.tech());
            }
        }

        for (Integer period : system.optimizePeriods()) {
            if (!periods.contains(period)) {
                problems.add("Optimize period is not part of the time horizon: " + period);
            }
        }

        for (String tech : system.technologies()) {
            if (!networkTechs.contains(tech)) {
                problems.add("Technology is declared but never used: " + tech);
            }
        }

        return new ArrayList<>(problems);
    }
}
