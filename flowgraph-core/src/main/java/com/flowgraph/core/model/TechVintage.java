package com.flowgraph.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A technology of a given vintage, independent of the operating period.
 *
 * @param tech technology name
 * @param vintage vintage (build year)
 */
public record TechVintage(
    String tech,
    int vintage
) implements Comparable<TechVintage> {

    private static final Comparator<TechVintage> ORDER = Comparator
        .comparing(TechVintage::tech)
        .thenComparingInt(TechVintage::vintage);

    /**
     * Compact constructor with validation.
     */
    public TechVintage {
        Objects.requireNonNull(tech, "tech must not be null");
    }

    @Override
    public int compareTo(TechVintage other) {
        return ORDER.compare(this, other);
    }
}
