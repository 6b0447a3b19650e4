package com.metricsentinel.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one rule that did not hold for a {@link CompositeMetric}.
 *
 * <p>
 * Produced by the rules engine; one instance per failing rule. The offending
 * elements are key paths relative to {@link #getParentMetric()}, so the
 * actual values can be resolved with {@link CompositeMetric#element(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValidationStatus {

    /** Severity of a status. */
    public enum Level {
        IMPROVEMENT("improvement"),
        ALERT("alert"),
        FAILURE("failure");

        private final String label;

        Level(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Level level;
    private final String text;
    private final CompositeMetric parentMetric;
    private final Set<String> offendingElements;

    /**
     * @param level             severity; must not be {@code null}
     * @param text              human-readable report; must not be {@code null}
     * @param parentMetric      the metric that was checked; must not be {@code null}
     * @param offendingElements relative key paths that violated the rule
     */
    public ValidationStatus(Level level, String text, CompositeMetric parentMetric,
            Collection<String> offendingElements) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.parentMetric = Objects.requireNonNull(parentMetric, "parentMetric must not be null");
        this.offendingElements = Collections.unmodifiableSet(new LinkedHashSet<>(
                Objects.requireNonNull(offendingElements, "offendingElements must not be null")));
    }

    public Level getLevel() {
        return level;
    }

    public String getText() {
        return text;
    }

    public CompositeMetric getParentMetric() {
        return parentMetric;
    }

    /**
     * @return unmodifiable, ordered set of offending key paths
     */
    public Set<String> getOffendingElements() {
        return offendingElements;
    }

    /**
     * Map every offending key path to the composite that was checked. Callers
     * resolve the leaf itself with {@code parent.element(path)}.
     *
     * @return unmodifiable, ordered map of key path to parent metric
     */
    public Map<String, CompositeMetric> offendingMetrics() {
        Map<String, CompositeMetric> result = new LinkedHashMap<>();
        for (String element : offendingElements) {
            result.put(element, parentMetric);
        }
        return Collections.unmodifiableMap(result);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ValidationStatus that))
            return false;
        return level == that.level
                && text.equals(that.text)
                && parentMetric.equals(that.parentMetric)
                && offendingElements.equals(that.offendingElements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, text, parentMetric, offendingElements);
    }

    @Override
    public String toString() {
        return "ValidationStatus{" +
                "level=" + level +
                ", metric='" + parentMetric.getName() + '\'' +
                ", offendingElements=" + offendingElements +
                '}';
    }
}
