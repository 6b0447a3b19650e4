package com.metricsentinel.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Informational key/value data attached to a stored metric, such as the
 * host or build that produced it.
 *
 * <p>
 * Values are strings or integers; integral values are held as {@link Long}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Metadata {

    private static final Metadata EMPTY = new Metadata(Map.of());

    private final Map<String, Object> values;

    /**
     * @param values metadata pairs; must not be {@code null}
     * @throws IllegalArgumentException if a value is neither a string nor an
     *                                  integer
     */
    public Metadata(Map<String, ?> values) {
        Objects.requireNonNull(values, "Metadata values must not be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String) {
                copy.put(entry.getKey(), value);
            } else if (value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte) {
                copy.put(entry.getKey(), ((Number) value).longValue());
            } else {
                throw new IllegalArgumentException("Metadata value for '" + entry.getKey()
                        + "' must be a string or integer, got: " + value);
            }
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static Metadata empty() {
        return EMPTY;
    }

    /**
     * @return unmodifiable, ordered view of the metadata pairs
     */
    public Map<String, Object> getValues() {
        return values;
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Metadata that))
            return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + values;
    }
}
