package com.flowgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Energy-system dataset: the sets, process network and (optional) solved results that
 * diagrams are drawn from.
 *
 * <p>Loaded from JSON or YAML. Result lists may be empty for a model that has not been
 * solved; structural diagrams are still produced in that case.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * name: utopia
 * periods: [1990, 2000, 2010]
 * optimizePeriods: [1990, 2000]
 * seasons: [winter, summer]
 * timesOfDay: [day, night]
 * technologies: [IMPCOAL, E01]
 * carriers: [coal, ELC]
 * efficiencies:
 *   - { input: ethos, tech: IMPCOAL, vintage: 1990, output: coal }
 * processes:
 *   - { period: 1990, tech: IMPCOAL, vintage: 1990 }
 * }</pre>
 *
 * @param name dataset name
 * @param periods all periods of the time horizon, ascending
 * @param optimizePeriods periods that were optimized
 * @param seasons seasons of the time slices
 * @param timesOfDay times of day of the time slices
 * @param technologies all technologies
 * @param carriers physical energy carriers
 * @param emissions emission commodities
 * @param efficiencies process network
 * @param processes active (period, tech, vintage) processes
 * @param capacities installed capacity per vintage
 * @param periodCapacities available capacity per period and technology
 * @param vintageActivities activity per process
 * @param flows flows per time slice
 * @param emissionActivities emitting process paths
 * @param emissionTotals emitted amounts per period and technology
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnergySystem(
    @JsonProperty("name") String name,
    @JsonProperty("periods") List<Integer> periods,
    @JsonProperty("optimizePeriods") List<Integer> optimizePeriods,
    @JsonProperty("seasons") List<String> seasons,
    @JsonProperty("timesOfDay") List<String> timesOfDay,
    @JsonProperty("technologies") List<String> technologies,
    @JsonProperty("carriers") List<String> carriers,
    @JsonProperty("emissions") List<String> emissions,
    @JsonProperty("efficiencies") List<Efficiency> efficiencies,
    @JsonProperty("processes") List<ProcessKey> processes,
    @JsonProperty("capacities") List<Capacity> capacities,
    @JsonProperty("periodCapacities") List<PeriodCapacity> periodCapacities,
    @JsonProperty("vintageActivities") List<VintageActivity> vintageActivities,
    @JsonProperty("flows") List<Flow> flows,
    @JsonProperty("emissionActivities") List<EmissionActivity> emissionActivities,
    @JsonProperty("emissionTotals") List<EmissionTotal> emissionTotals
) {
    /**
     * Compact constructor; missing lists become empty lists.
     */
    public EnergySystem {
        periods = copy(periods);
        optimizePeriods = copy(optimizePeriods);
        seasons = copy(seasons);
        timesOfDay = copy(timesOfDay);
        technologies = copy(technologies);
        carriers = copy(carriers);
        emissions = copy(emissions);
        efficiencies = copy(efficiencies);
        processes = copy(processes);
        capacities = copy(capacities);
        periodCapacities = copy(periodCapacities);
        vintageActivities = copy(vintageActivities);
        flows = copy(flows);
        emissionActivities = copy(emissionActivities);
        emissionTotals = copy(emissionTotals);
    }

    /**
     * Returns true if the dataset carries solved results.
     *
     * @return true if any result list is non-empty
     */
    public boolean hasResults() {
        return !capacities.isEmpty() || !periodCapacities.isEmpty() || !vintageActivities.isEmpty()
            || !flows.isEmpty() || !emissionTotals.isEmpty();
    }

    /**
     * Combines this dataset with another one. Lists are concatenated; the name of this
     * dataset is kept.
     *
     * @param other dataset to append
     * @return merged dataset
     */
    public EnergySystem merge(EnergySystem other) {
        return new EnergySystem(
            name != null ? name : other.name(),
            concat(periods, other.periods()),
            concat(optimizePeriods, other.optimizePeriods()),
            concat(seasons, other.seasons()),
            concat(timesOfDay, other.timesOfDay()),
            concat(technologies, other.technologies()),
            concat(carriers, other.carriers()),
            concat(emissions, other.emissions()),
            concat(efficiencies, other.efficiencies()),
            concat(processes, other.processes()),
            concat(capacities, other.capacities()),
            concat(periodCapacities, other.periodCapacities()),
            concat(vintageActivities, other.vintageActivities()),
            concat(flows, other.flows()),
            concat(emissionActivities, other.emissionActivities()),
            concat(emissionTotals, other.emissionTotals())
        );
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
