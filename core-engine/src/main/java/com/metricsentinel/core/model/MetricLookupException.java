package com.metricsentinel.core.model;

import java.util.NoSuchElementException;

/**
 * Thrown when a key path is malformed or does not resolve within a
 * {@link CompositeMetric}.
 *
 * @since 1.0.0
 */
public class MetricLookupException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    public MetricLookupException(String message) {
        super(message);
    }
}
