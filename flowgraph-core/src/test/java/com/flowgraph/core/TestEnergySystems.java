package com.flowgraph.core;

import com.flowgraph.core.model.Capacity;
import com.flowgraph.core.model.Efficiency;
import com.flowgraph.core.model.EmissionActivity;
import com.flowgraph.core.model.EmissionTotal;
import com.flowgraph.core.model.EnergySystem;
import com.flowgraph.core.model.Flow;
import com.flowgraph.core.model.PeriodCapacity;
import com.flowgraph.core.model.ProcessKey;
import com.flowgraph.core.model.VintageActivity;

import java.util.List;

/**
 * Small solved energy system shared by the tests.
 *
 * <pre>
 * ethos -> IMPCOAL -> coal -> E01 (1990, 2000) -> ELC -> RL1 -> RL
 *                          -> E70 (1990, never runs)
 * IDLE: declared, no efficiency
 * </pre>
 *
 * RL1 has zero capacity in 2000; E01 emits co2 in 1990.
 */
public final class TestEnergySystems {

    private TestEnergySystems() {
    }

    public static EnergySystem structureOnly() {
        EnergySystem solved = solved();
        return new EnergySystem(solved.name(), solved.periods(), solved.optimizePeriods(), solved.seasons(),
            solved.timesOfDay(), solved.technologies(), solved.carriers(), solved.emissions(),
            solved.efficiencies(), solved.processes(), null, null, null, null, solved.emissionActivities(), null);
    }

    public static EnergySystem solved() {
        return new EnergySystem(
            "utopia",
            List.of(1990, 2000),
            List.of(1990, 2000),
            List.of("winter", "summer"),
            List.of("day", "night"),
            List.of("IMPCOAL", "E01", "E70", "RL1", "IDLE"),
            List.of("ethos", "coal", "ELC", "RL"),
            List.of("co2"),
            List.of(
                new Efficiency("ethos", "IMPCOAL", 1990, "coal"),
                new Efficiency("coal", "E01", 1990, "ELC"),
                new Efficiency("coal", "E01", 2000, "ELC"),
                new Efficiency("coal", "E70", 1990, "ELC"),
                new Efficiency("ELC", "RL1", 1990, "RL")),
            List.of(
                new ProcessKey(1990, "IMPCOAL", 1990),
                new ProcessKey(2000, "IMPCOAL", 1990),
                new ProcessKey(1990, "E01", 1990),
                new ProcessKey(2000, "E01", 1990),
                new ProcessKey(2000, "E01", 2000),
                new ProcessKey(1990, "E70", 1990),
                new ProcessKey(1990, "RL1", 1990),
                new ProcessKey(2000, "RL1", 1990)),
            List.of(
                new Capacity("IMPCOAL", 1990, 100),
                new Capacity("E01", 1990, 10),
                new Capacity("E01", 2000, 5),
                new Capacity("RL1", 1990, 8)),
            List.of(
                new PeriodCapacity(1990, "IMPCOAL", 100),
                new PeriodCapacity(2000, "IMPCOAL", 100),
                new PeriodCapacity(1990, "E01", 10),
                new PeriodCapacity(2000, "E01", 15),
                new PeriodCapacity(1990, "RL1", 8),
                new PeriodCapacity(2000, "RL1", 0)),
            List.of(
                new VintageActivity(1990, "IMPCOAL", 1990, 40),
                new VintageActivity(2000, "IMPCOAL", 1990, 30),
                new VintageActivity(1990, "E01", 1990, 12),
                new VintageActivity(2000, "E01", 1990, 8),
                new VintageActivity(2000, "E01", 2000, 4),
                new VintageActivity(1990, "RL1", 1990, 6)),
            List.of(
                new Flow(1990, "winter", "day", "ethos", "IMPCOAL", 1990, "coal", 40, 40),
                new Flow(2000, "winter", "day", "ethos", "IMPCOAL", 1990, "coal", 30, 30),
                new Flow(1990, "winter", "day", "coal", "E01", 1990, "ELC", 5, 2),
                new Flow(1990, "summer", "night", "coal", "E01", 1990, "ELC", 7, 3),
                new Flow(2000, "winter", "day", "coal", "E01", 1990, "ELC", 8, 3),
                new Flow(2000, "winter", "day", "coal", "E01", 2000, "ELC", 4, 1.5),
                new Flow(1990, "winter", "day", "ELC", "RL1", 1990, "RL", 6, 5)),
            List.of(new EmissionActivity("co2", "coal", "E01", 1990, "ELC")),
            List.of(new EmissionTotal("co2", 1990, "E01", 2.5))
        );
    }
}
