package com.flowgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Total capacity of a technology available in a period, summed over vintages.
 *
 * @param period period
 * @param tech technology name
 * @param value available capacity
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PeriodCapacity(
    @JsonProperty("period") int period,
    @JsonProperty("tech") String tech,
    @JsonProperty("value") double value
) {
    /**
     * Compact constructor with validation.
     */
    public PeriodCapacity {
        Objects.requireNonNull(tech, "tech must not be null");
    }
}
