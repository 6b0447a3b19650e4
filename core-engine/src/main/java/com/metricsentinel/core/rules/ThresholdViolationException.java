package com.metricsentinel.core.rules;

import com.metricsentinel.core.model.CompositeMetric;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Raised by {@link Rule#validate} when one or more leaves of a composite
 * metric break the rule's bound.
 *
 * <p>
 * The message holds one line per offending path showing the failing
 * comparison.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdViolationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient CompositeMetric parentMetric;
    private final Set<String> offendingElements;

    /**
     * @param message           per-path report
     * @param parentMetric      the composite that was checked
     * @param offendingElements key paths, relative to {@code parentMetric},
     *                          of the leaves that broke the rule
     */
    public ThresholdViolationException(String message, CompositeMetric parentMetric,
            Collection<String> offendingElements) {
        super(message);
        this.parentMetric = Objects.requireNonNull(parentMetric, "parentMetric must not be null");
        this.offendingElements = Collections.unmodifiableSet(new LinkedHashSet<>(offendingElements));
    }

    public CompositeMetric getParentMetric() {
        return parentMetric;
    }

    public Set<String> getOffendingElements() {
        return offendingElements;
    }
}
