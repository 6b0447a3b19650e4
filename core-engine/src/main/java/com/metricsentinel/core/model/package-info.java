/**
 * Composite metric data model.
 *
 * <ul>
 * <li>{@link com.metricsentinel.core.model.Metric}: named numeric leaf</li>
 * <li>{@link com.metricsentinel.core.model.CompositeMetric}: named branch of
 * uniquely named children</li>
 * <li>{@link com.metricsentinel.core.model.ValidationStatus}: outcome of a
 * failing rule</li>
 * </ul>
 *
 * <p>
 * Trees flatten to {@code /root/child#leaf} paths and are rebuilt with
 * {@link com.metricsentinel.core.model.BasicMetric#fromFlattened(java.util.Map)}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.model;
