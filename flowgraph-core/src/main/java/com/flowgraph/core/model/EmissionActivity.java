package com.flowgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Declares that a process path emits a pollutant.
 *
 * @param emission emission commodity
 * @param input input carrier
 * @param tech technology name
 * @param vintage vintage
 * @param output output carrier
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmissionActivity(
    @JsonProperty("emission") String emission,
    @JsonProperty("input") String input,
    @JsonProperty("tech") String tech,
    @JsonProperty("vintage") int vintage,
    @JsonProperty("output") String output
) {
    /**
     * Compact constructor with validation.
     */
    public EmissionActivity {
        Objects.requireNonNull(emission, "emission must not be null");
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(tech, "tech must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }
}
