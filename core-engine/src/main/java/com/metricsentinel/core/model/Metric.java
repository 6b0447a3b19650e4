package com.metricsentinel.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Leaf metric: a single named numeric value.
 *
 * <p>
 * Values keep their numeric kind. Integral inputs ({@code byte} through
 * {@code long}, {@link BigInteger}) are stored as {@link Long}; floating
 * inputs ({@code float}, {@code double}, {@link BigDecimal}) as
 * {@link Double}. The kind therefore survives a flatten / store / unflatten
 * cycle unchanged.
 * </p>
 *
 * <p>
 * Instances are immutable. Two metrics are equal when their names match and
 * their values are numerically equal. A {@code Long} and a {@code Double}
 * are compared exactly, without rounding the {@code Long}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Metric extends BasicMetric {

    private final Number value;

    /**
     * @param name  metric name; non-empty and free of {@code '#'}
     * @param value numeric value; must not be {@code null}
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if the name is invalid or the value is
     *                                  not a supported number
     */
    public Metric(String name, Number value) {
        super(name);
        this.value = normalize(value);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Metric name cannot be empty");
        }
        if (name.indexOf(LEAF_SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Metric name cannot contain '#': " + name);
        }
    }

    /**
     * @return the value, either a {@link Long} or a {@link Double}
     */
    public Number getValue() {
        return value;
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    /**
     * @return {@code true} if the value was supplied as an integral number
     */
    public boolean isIntegral() {
        return value instanceof Long;
    }

    @Override
    public Map<String, Number> flatten(String prefix) {
        Map<String, Number> result = new LinkedHashMap<>();
        if (prefix == null || prefix.isEmpty()) {
            result.put(getName(), value);
        } else {
            result.put(prefix + LEAF_SEPARATOR + getName(), value);
        }
        return result;
    }

    private static Number normalize(Number value) {
        if (value == null) {
            throw new IllegalArgumentException("Metric values must be numbers");
        }
        if (value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte
                || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return value.longValue();
        }
        if (value instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Metric value out of range: " + big, e);
            }
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return value.doubleValue();
        }
        throw new IllegalArgumentException(
                "Unsupported metric value type: " + value.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Metric that))
            return false;
        if (!getName().equals(that.getName()))
            return false;
        if (value instanceof Long a && that.value instanceof Long b) {
            return a.longValue() == b.longValue();
        }
        if (value instanceof Double a && that.value instanceof Double b) {
            return Double.compare(a, b) == 0;
        }
        Long integral = (Long) (value instanceof Long ? value : that.value);
        Double floating = (Double) (value instanceof Double ? value : that.value);
        return exactlyEqual(integral, floating);
    }

    private static boolean exactlyEqual(long integral, double floating) {
        if (!Double.isFinite(floating)) {
            return false;
        }
        return BigDecimal.valueOf(integral).compareTo(new BigDecimal(floating)) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), Double.hashCode(value.doubleValue()));
    }

    @Override
    public String toString() {
        return "Metric{name='" + getName() + "', value=" + value + '}';
    }
}
