package com.flowgraph.core.dot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Ordered DOT attribute list, rendered as {@code key="value", key2="value2"}.
 *
 * <p>Keys are validated as plain DOT identifiers and values are always quoted and
 * escaped, so an attribute value can never terminate the statement it belongs to.
 */
public final class DotAttributes {

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final List<String> rendered = new ArrayList<>();

    private DotAttributes() {
    }

    /**
     * Creates an empty attribute list.
     *
     * @return empty attribute list
     */
    public static DotAttributes create() {
        return new DotAttributes();
    }

    /**
     * Appends an attribute. Null values are skipped.
     *
     * @param key attribute name
     * @param value attribute value
     * @return this list
     * @throws IllegalArgumentException if the key is not a valid DOT identifier
     */
    public DotAttributes add(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        if (!KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid DOT attribute name: " + key);
        }
        if (value != null) {
            rendered.add(key + "=" + DotSerializer.quote(String.valueOf(value)));
        }
        return this;
    }

    public boolean isEmpty() {
        return rendered.isEmpty();
    }

    /**
     * Renders the list, or returns null when it holds no attributes.
     *
     * @return rendered list or null
     */
    public String renderOrNull() {
        return isEmpty() ? null : toString();
    }

    @Override
    public String toString() {
        return String.join(", ", rendered);
    }
}
