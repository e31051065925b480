package com.flowgraph.core.source;

import com.flowgraph.core.model.Capacity;
import com.flowgraph.core.model.Efficiency;
import com.flowgraph.core.model.EmissionActivity;
import com.flowgraph.core.model.EmissionTotal;
import com.flowgraph.core.model.EnergySystem;
import com.flowgraph.core.model.Flow;
import com.flowgraph.core.model.PeriodCapacity;
import com.flowgraph.core.model.ProcessKey;
import com.flowgraph.core.model.TechVintage;
import com.flowgraph.core.model.VintageActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * {@link EnergySystemQuery} backed by in-memory indexes built once from an
 * {@link EnergySystem} dataset.
 *
 * <p>All indexes are filled in the constructor and never modified afterwards, which
 * makes the instance safe to share between concurrently running diagram jobs.
 */
public class IndexedEnergySystem implements EnergySystemQuery {

    private static final Logger log = LoggerFactory.getLogger(IndexedEnergySystem.class);

    private final SortedSet<Integer> periods;
    private final SortedSet<Integer> optimizePeriods;
    private final List<String> seasons;
    private final List<String> timesOfDay;
    private final SortedSet<String> technologies;
    private final SortedSet<String> carriers;
    private final SortedSet<String> emissions;
    private final SortedSet<ProcessKey> activeProcesses;
    private final List<EmissionActivity> emissionActivities;
    private final boolean hasResults;

    // (tech, vintage) -> input -> outputs
    private final Map<TechVintage, Map<String, SortedSet<String>>> network = new HashMap<>();
    private final Map<String, SortedSet<TechVintage>> byInput = new HashMap<>();
    private final Map<String, SortedSet<TechVintage>> byOutput = new HashMap<>();
    private final Map<String, SortedSet<Integer>> vintagesByPeriodTech = new HashMap<>();

    private final Map<TechVintage, Double> capacities = new HashMap<>();
    private final Map<ProcessKey, Double> periodCapacities = new TreeMap<>();
    private final Map<ProcessKey, Double> vintageActivities = new HashMap<>();
    private final Map<SliceKey, Flow> flows = new HashMap<>();
    private final Map<PathKey, double[]> flowTotals = new HashMap<>();
    private final Map<String, Double> consumption = new HashMap<>();
    private final Map<String, Double> production = new HashMap<>();
    private final Map<String, Double> emissionTotals = new HashMap<>();

    /**
     * Builds the indexes for a dataset.
     *
     * @param system dataset
     */
    public IndexedEnergySystem(EnergySystem system) {
        Objects.requireNonNull(system, "system must not be null");

        this.periods = sortedUnmodifiable(system.periods());
        this.optimizePeriods = sortedUnmodifiable(system.optimizePeriods());
        this.seasons = List.copyOf(new LinkedHashSet<>(system.seasons()));
        this.timesOfDay = List.copyOf(new LinkedHashSet<>(system.timesOfDay()));
        this.technologies = sortedUnmodifiable(system.technologies());
        this.carriers = sortedUnmodifiable(system.carriers());
        this.emissions = sortedUnmodifiable(system.emissions());
        this.emissionActivities = List.copyOf(new LinkedHashSet<>(system.emissionActivities()));
        this.hasResults = system.hasResults();

        indexNetwork(system.efficiencies());
        this.activeProcesses = indexProcesses(system.processes());
        indexResults(system);

        log.debug("Indexed energy system '{}': {} technologies, {} carriers, {} active processes, {} flows",
            system.name(), technologies.size(), carriers.size(), activeProcesses.size(), flows.size());
    }

    private void indexNetwork(List<Efficiency> efficiencies) {
        for (Efficiency eff : efficiencies) {
            TechVintage tv = new TechVintage(eff.tech(), eff.vintage());
            network.computeIfAbsent(tv, k -> new TreeMap<>())
                .computeIfAbsent(eff.input(), k -> new TreeSet<>())
                .add(eff.output());
            byInput.computeIfAbsent(eff.input(), k -> new TreeSet<>()).add(tv);
            byOutput.computeIfAbsent(eff.output(), k -> new TreeSet<>()).add(tv);
        }
    }

    private SortedSet<ProcessKey> indexProcesses(List<ProcessKey> processes) {
        SortedSet<ProcessKey> active = new TreeSet<>();
        for (ProcessKey process : processes) {
            if (!network.containsKey(new TechVintage(process.tech(), process.vintage()))) {
                log.debug("Ignoring process without efficiency data: {}", process);
                continue;
            }
            active.add(process);
            vintagesByPeriodTech.computeIfAbsent(key(process.period(), process.tech()), k -> new TreeSet<>())
                .add(process.vintage());
        }
        return Collections.unmodifiableSortedSet(active);
    }

    private void indexResults(EnergySystem system) {
        for (Capacity cap : system.capacities()) {
            capacities.put(new TechVintage(cap.tech(), cap.vintage()), cap.value());
        }
        for (PeriodCapacity cap : system.periodCapacities()) {
            periodCapacities.put(new ProcessKey(cap.period(), cap.tech(), 0), cap.value());
        }
        for (VintageActivity act : system.vintageActivities()) {
            vintageActivities.put(new ProcessKey(act.period(), act.tech(), act.vintage()), act.value());
        }
        for (Flow flow : system.flows()) {
            ProcessKey process = flow.process();
            flows.put(new SliceKey(process, flow.season(), flow.timeOfDay(), flow.input(), flow.output()), flow);

            double[] totals = flowTotals.computeIfAbsent(new PathKey(process, flow.input(), flow.output()), k -> new double[2]);
            totals[0] += flow.flowIn();
            totals[1] += flow.flowOut();

            consumption.merge(key(flow.period(), flow.input(), flow.tech()), flow.flowIn(), Double::sum);
            production.merge(key(flow.period(), flow.tech(), flow.output()), flow.flowOut(), Double::sum);
        }
        for (EmissionTotal total : system.emissionTotals()) {
            emissionTotals.merge(key(total.emission(), total.period(), total.tech()), total.amount(), Double::sum);
        }
    }

    @Override
    public SortedSet<Integer> periods() {
        return periods;
    }

    @Override
    public SortedSet<Integer> optimizePeriods() {
        return optimizePeriods;
    }

    @Override
    public List<String> seasons() {
        return seasons;
    }

    @Override
    public List<String> timesOfDay() {
        return timesOfDay;
    }

    @Override
    public SortedSet<String> technologies() {
        return technologies;
    }

    @Override
    public SortedSet<String> carriers() {
        return carriers;
    }

    @Override
    public SortedSet<String> emissions() {
        return emissions;
    }

    @Override
    public SortedSet<ProcessKey> activeProcesses() {
        return activeProcesses;
    }

    @Override
    public boolean isActive(ProcessKey process) {
        return activeProcesses.contains(process);
    }

    @Override
    public SortedSet<String> processInputs(ProcessKey process) {
        if (!isActive(process)) {
            return Collections.emptySortedSet();
        }
        Map<String, SortedSet<String>> links = network.get(techVintage(process));
        return Collections.unmodifiableSortedSet(new TreeSet<>(links.keySet()));
    }

    @Override
    public SortedSet<String> processOutputs(ProcessKey process) {
        if (!isActive(process)) {
            return Collections.emptySortedSet();
        }
        SortedSet<String> outputs = new TreeSet<>();
        network.get(techVintage(process)).values().forEach(outputs::addAll);
        return Collections.unmodifiableSortedSet(outputs);
    }

    @Override
    public SortedSet<String> processOutputsByInput(ProcessKey process, String input) {
        if (!isActive(process)) {
            return Collections.emptySortedSet();
        }
        SortedSet<String> outputs = network.get(techVintage(process)).get(input);
        return outputs == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(outputs);
    }

    @Override
    public SortedSet<TechVintage> processesByInput(String carrier) {
        return unmodifiable(byInput.get(carrier));
    }

    @Override
    public SortedSet<TechVintage> processesByOutput(String carrier) {
        return unmodifiable(byOutput.get(carrier));
    }

    @Override
    public SortedSet<Integer> processVintages(int period, String tech) {
        return unmodifiable(vintagesByPeriodTech.get(key(period, tech)));
    }

    @Override
    public OptionalDouble capacity(String tech, int vintage) {
        Double value = capacities.get(new TechVintage(tech, vintage));
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public OptionalDouble periodCapacity(int period, String tech) {
        Double value = periodCapacities.get(new ProcessKey(period, tech, 0));
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public SortedSet<ProcessKey> periodCapacityKeys() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(periodCapacities.keySet()));
    }

    @Override
    public double vintageActivity(ProcessKey process) {
        return vintageActivities.getOrDefault(process, 0.0);
    }

    @Override
    public double flowIn(ProcessKey process, String season, String timeOfDay, String input, String output) {
        Flow flow = flows.get(new SliceKey(process, season, timeOfDay, input, output));
        return flow == null ? 0.0 : flow.flowIn();
    }

    @Override
    public double flowOut(ProcessKey process, String season, String timeOfDay, String input, String output) {
        Flow flow = flows.get(new SliceKey(process, season, timeOfDay, input, output));
        return flow == null ? 0.0 : flow.flowOut();
    }

    @Override
    public double totalFlowIn(ProcessKey process, String input, String output) {
        double[] totals = flowTotals.get(new PathKey(process, input, output));
        return totals == null ? 0.0 : totals[0];
    }

    @Override
    public double totalFlowOut(ProcessKey process, String input, String output) {
        double[] totals = flowTotals.get(new PathKey(process, input, output));
        return totals == null ? 0.0 : totals[1];
    }

    @Override
    public double energyConsumption(int period, String input, String tech) {
        return consumption.getOrDefault(key(period, input, tech), 0.0);
    }

    @Override
    public double energyProduction(int period, String tech, String output) {
        return production.getOrDefault(key(period, tech, output), 0.0);
    }

    @Override
    public double emissionTotal(String emission, int period, String tech) {
        return emissionTotals.getOrDefault(key(emission, period, tech), 0.0);
    }

    @Override
    public List<EmissionActivity> emissionActivities() {
        return emissionActivities;
    }

    @Override
    public boolean hasResults() {
        return hasResults;
    }

    private static TechVintage techVintage(ProcessKey process) {
        return new TechVintage(process.tech(), process.vintage());
    }

    private static String key(Object... parts) {
        StringBuilder sb = new StringBuilder();
        for (Object part : parts) {
            sb.append(part).append('\u0000');
        }
        return sb.toString();
    }

    private static <T extends Comparable<T>> SortedSet<T> sortedUnmodifiable(List<T> values) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }

    private static <T> SortedSet<T> unmodifiable(SortedSet<T> set) {
        return set == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(set);
    }

    private record SliceKey(ProcessKey process, String season, String timeOfDay, String input, String output) {
    }

    private record PathKey(ProcessKey process, String input, String output) {
    }
}
