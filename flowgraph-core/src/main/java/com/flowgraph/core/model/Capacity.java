package com.flowgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Installed capacity of a technology vintage.
 *
 * @param tech technology name
 * @param vintage vintage
 * @param value capacity
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Capacity(
    @JsonProperty("tech") String tech,
    @JsonProperty("vintage") int vintage,
    @JsonProperty("value") double value
) {
    /**
     * Compact constructor with validation.
     */
    public Capacity {
        Objects.requireNonNull(tech, "tech must not be null");
    }
}
