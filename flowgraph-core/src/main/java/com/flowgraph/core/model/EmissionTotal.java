package com.flowgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Amount of an emission produced by a technology in a period.
 *
 * @param emission emission commodity
 * @param period period
 * @param tech technology name
 * @param amount emitted amount
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmissionTotal(
    @JsonProperty("emission") String emission,
    @JsonProperty("period") int period,
    @JsonProperty("tech") String tech,
    @JsonProperty("amount") double amount
) {
    /**
     * Compact constructor with validation.
     */
    public EmissionTotal {
        Objects.requireNonNull(emission, "emission must not be null");
        Objects.requireNonNull(tech, "tech must not be null");
    }
}
