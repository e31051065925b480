package com.flowgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies a process: a technology of a given vintage operating in a given period.
 *
 * @param period operating period
 * @param tech technology name
 * @param vintage vintage (build year)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessKey(
    @JsonProperty("period") int period,
    @JsonProperty("tech") String tech,
    @JsonProperty("vintage") int vintage
) implements Comparable<ProcessKey> {

    private static final Comparator<ProcessKey> ORDER = Comparator
        .comparingInt(ProcessKey::period)
        .thenComparing(ProcessKey::tech)
        .thenComparingInt(ProcessKey::vintage);

    /**
     * Compact constructor with validation.
     */
    public ProcessKey {
        Objects.requireNonNull(tech, "tech must not be null");
    }

    @Override
    public int compareTo(ProcessKey other) {
        return ORDER.compare(this, other);
    }
}
