package com.flowgraph.core.source;

import com.flowgraph.core.model.EmissionActivity;
import com.flowgraph.core.model.ProcessKey;
import com.flowgraph.core.model.TechVintage;

import java.util.List;
import java.util.OptionalDouble;
import java.util.SortedSet;

/**
 * Read-only queries over an energy-system model.
 *
 * <p>This is the only coupling point between diagram generation and the data it draws.
 * Implementations must be safe for concurrent reads, as a single instance is shared by
 * every diagram job of a batch. All returned collections are unmodifiable and ordered
 * deterministically.
 *
 * @see IndexedEnergySystem
 */
public interface EnergySystemQuery {

    /** @return all periods of the time horizon, ascending */
    SortedSet<Integer> periods();

    /** @return optimized periods, ascending */
    SortedSet<Integer> optimizePeriods();

    /** @return seasons, in declaration order */
    List<String> seasons();

    /** @return times of day, in declaration order */
    List<String> timesOfDay();

    /** @return all technologies, sorted */
    SortedSet<String> technologies();

    /** @return physical energy carriers, sorted */
    SortedSet<String> carriers();

    /** @return emission commodities, sorted */
    SortedSet<String> emissions();

    /**
     * Returns the processes that are active in their period.
     *
     * @return active processes, sorted by period, tech, vintage
     */
    SortedSet<ProcessKey> activeProcesses();

    /**
     * Returns true if the process is active.
     *
     * @param process process key
     * @return true if active
     */
    boolean isActive(ProcessKey process);

    /**
     * Returns the input carriers of an active process.
     *
     * @param process process key
     * @return input carriers, empty if the process is not active
     */
    SortedSet<String> processInputs(ProcessKey process);

    /**
     * Returns the output carriers of an active process.
     *
     * @param process process key
     * @return output carriers, empty if the process is not active
     */
    SortedSet<String> processOutputs(ProcessKey process);

    /**
     * Returns the outputs an active process produces from a given input.
     *
     * @param process process key
     * @param input input carrier
     * @return output carriers
     */
    SortedSet<String> processOutputsByInput(ProcessKey process, String input);

    /**
     * Returns the technology vintages that consume a carrier.
     *
     * @param carrier carrier name
     * @return consuming technology vintages
     */
    SortedSet<TechVintage> processesByInput(String carrier);

    /**
     * Returns the technology vintages that produce a carrier.
     *
     * @param carrier carrier name
     * @return producing technology vintages
     */
    SortedSet<TechVintage> processesByOutput(String carrier);

    /**
     * Returns the vintages of a technology active in a period.
     *
     * @param period period
     * @param tech technology
     * @return vintages, ascending
     */
    SortedSet<Integer> processVintages(int period, String tech);

    /**
     * Returns installed capacity of a technology vintage.
     *
     * @param tech technology
     * @param vintage vintage
     * @return capacity, or empty if not part of the results
     */
    OptionalDouble capacity(String tech, int vintage);

    /**
     * Returns capacity available to a technology in a period.
     *
     * @param period period
     * @param tech technology
     * @return available capacity, or empty if not part of the results
     */
    OptionalDouble periodCapacity(int period, String tech);

    /**
     * Returns the (period, tech) pairs with available capacity in the results.
     *
     * @return process keys with vintage 0, sorted
     */
    SortedSet<ProcessKey> periodCapacityKeys();

    /**
     * Returns the activity of a process.
     *
     * @param process process key
     * @return activity, 0 if absent
     */
    double vintageActivity(ProcessKey process);

    /**
     * Returns the flow into a process for one time slice and input/output pair.
     *
     * @return flow, 0 if absent
     */
    double flowIn(ProcessKey process, String season, String timeOfDay, String input, String output);

    /**
     * Returns the flow out of a process for one time slice and input/output pair.
     *
     * @return flow, 0 if absent
     */
    double flowOut(ProcessKey process, String season, String timeOfDay, String input, String output);

    /**
     * Returns the flow into a process for an input/output pair, summed over all time slices.
     *
     * @return summed flow
     */
    double totalFlowIn(ProcessKey process, String input, String output);

    /**
     * Returns the flow out of a process for an input/output pair, summed over all time slices.
     *
     * @return summed flow
     */
    double totalFlowOut(ProcessKey process, String input, String output);

    /**
     * Returns the energy of an input carrier consumed by a technology in a period.
     *
     * @return consumption summed over vintages, outputs and time slices
     */
    double energyConsumption(int period, String input, String tech);

    /**
     * Returns the energy of an output carrier produced by a technology in a period.
     *
     * @return production summed over vintages, inputs and time slices
     */
    double energyProduction(int period, String tech, String output);

    /**
     * Returns the amount of an emission produced by a technology in a period.
     *
     * @return emitted amount, 0 if absent
     */
    double emissionTotal(String emission, int period, String tech);

    /** @return emitting process paths */
    List<EmissionActivity> emissionActivities();

    /** @return true if the model carries solved results */
    boolean hasResults();
}
