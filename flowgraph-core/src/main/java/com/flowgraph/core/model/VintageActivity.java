package com.flowgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Activity of a process over a whole period.
 *
 * @param period period
 * @param tech technology name
 * @param vintage vintage
 * @param value activity
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VintageActivity(
    @JsonProperty("period") int period,
    @JsonProperty("tech") String tech,
    @JsonProperty("vintage") int vintage,
    @JsonProperty("value") double value
) {
    /**
     * Compact constructor with validation.
     */
    public VintageActivity {
        Objects.requireNonNull(tech, "tech must not be null");
    }
}
