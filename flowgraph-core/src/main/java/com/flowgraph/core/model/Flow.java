package com.flowgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Energy flowing through one input/output pair of a process in one time slice.
 *
 * @param period period
 * @param season season of the time slice
 * @param timeOfDay time of day of the time slice
 * @param input input carrier
 * @param tech technology name
 * @param vintage vintage
 * @param output output carrier
 * @param flowIn energy entering the process
 * @param flowOut energy leaving the process
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Flow(
    @JsonProperty("period") int period,
    @JsonProperty("season") String season,
    @JsonProperty("timeOfDay") String timeOfDay,
    @JsonProperty("input") String input,
    @JsonProperty("tech") String tech,
    @JsonProperty("vintage") int vintage,
    @JsonProperty("output") String output,
    @JsonProperty("flowIn") double flowIn,
    @JsonProperty("flowOut") double flowOut
) {
    /**
     * Compact constructor with validation.
     */
    public Flow {
        Objects.requireNonNull(season, "season must not be null");
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(tech, "tech must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }

    /**
     * Returns the process this flow belongs to.
     *
     * @return process key
     */
    public ProcessKey process() {
        return new ProcessKey(period, tech, vintage);
    }
}
