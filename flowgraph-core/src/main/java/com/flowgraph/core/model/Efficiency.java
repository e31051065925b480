package com.flowgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One link of the process network: a technology vintage converts an input carrier
 * into an output carrier.
 *
 * @param input input carrier
 * @param tech technology name
 * @param vintage vintage
 * @param output output carrier
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Efficiency(
    @JsonProperty("input") String input,
    @JsonProperty("tech") String tech,
    @JsonProperty("vintage") int vintage,
    @JsonProperty("output") String output
) {
    /**
     * Compact constructor with validation.
     */
    public Efficiency {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(tech, "tech must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }
}
