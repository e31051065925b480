package com.flowgraph.core.generator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Selects the slice of the model that one diagram job draws.
 *
 * <p>A scope belongs to one generator and carries an ordered set of named components,
 * e.g. {@code tech-results[tech=E01, period=2000]}. A whole-system scope has no components.
 *
 * @param generatorId id of the generator that owns the scope
 * @param components named scope components, in insertion order
 */
public record ScopeKey(
    String generatorId,
    Map<String, String> components
) {
    /**
     * Compact constructor with validation.
     */
    public ScopeKey {
        Objects.requireNonNull(generatorId, "generatorId must not be null");
        components = components == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    /**
     * Creates a whole-system scope.
     *
     * @param generatorId generator id
     * @return scope without components
     */
    public static ScopeKey whole(String generatorId) {
        return new ScopeKey(generatorId, Map.of());
    }

    /**
     * Creates a scope from alternating names and values.
     *
     * @param generatorId generator id
     * @param namesAndValues name1, value1, name2, value2, ...
     * @return scope
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public static ScopeKey of(String generatorId, Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Scope components must be name/value pairs");
        }
        Map<String, String> components = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            components.put(String.valueOf(namesAndValues[i]), String.valueOf(namesAndValues[i + 1]));
        }
        return new ScopeKey(generatorId, components);
    }

    /**
     * Returns a component value.
     *
     * @param name component name
     * @return value
     * @throws IllegalArgumentException if the scope has no such component
     */
    public String get(String name) {
        String value = components.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Scope " + this + " has no component '" + name + "'");
        }
        return value;
    }

    /**
     * Returns a numeric component value.
     *
     * @param name component name
     * @return value
     */
    public int getInt(String name) {
        return Integer.parseInt(get(name));
    }

    @Override
    public String toString() {
        if (components.isEmpty()) {
            return generatorId + "[*]";
        }
        return components.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", ", generatorId + "[", "]"));
    }
}
