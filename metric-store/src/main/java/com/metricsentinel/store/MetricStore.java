package com.metricsentinel.store;

import com.metricsentinel.core.codec.MetricStructures;
import com.metricsentinel.core.model.BasicMetric;
import com.metricsentinel.core.model.CompositeMetric;

import java.time.Instant;
import java.util.List;

/**
 * Persistence of metrics over time.
 *
 * <p>
 * A store keeps every posted metric with its timestamp and optional metadata.
 * Queries return metrics of one name, newest first, and honour any metadata
 * filters installed with {@link #filterOnMetadata}. Purges ignore filters.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricStore {

    /**
     * Store a metric.
     *
     * @param metric      the metric; must not be {@code null}
     * @param timestamp   when the metric was taken; must not be {@code null}
     * @param metadata    optional metadata, may be {@code null}
     * @param projectName optional project name, may be {@code null}
     * @param uuid        optional correlation id, may be {@code null}
     */
    void post(BasicMetric metric, Instant timestamp, Metadata metadata, String projectName, String uuid);

    default void post(BasicMetric metric, Instant timestamp) {
        post(metric, timestamp, null, null, null);
    }

    default void post(BasicMetric metric) {
        post(metric, Instant.now(), null, null, null);
    }

    /**
     * Store a data object as a metric.
     *
     * @param name        metric name
     * @param data        a data object accepted by
     *                    {@link MetricStructures#fromStructured}
     * @param timestamp   when the data was taken
     * @param metadata    optional metadata
     * @param projectName optional project name
     * @param uuid        optional correlation id
     * @throws IllegalArgumentException if {@code data} cannot be converted
     */
    default void postData(String name, Object data, Instant timestamp, Metadata metadata,
            String projectName, String uuid) {
        post(MetricStructures.fromStructured(name, data), timestamp, metadata, projectName, uuid);
    }

    default void postData(String name, Object data, Instant timestamp) {
        postData(name, data, timestamp, null, null, null);
    }

    /**
     * @param name   metric name
     * @param oldest earliest timestamp, inclusive
     * @param newest latest timestamp, inclusive
     * @return matching metrics, newest first
     */
    List<BasicMetric> metricsByDate(String name, Instant oldest, Instant newest);

    /**
     * @param name  metric name
     * @param count maximum number of metrics to return; must be positive
     * @return up to {@code count} of the most recent metrics, newest first
     */
    List<BasicMetric> metricsByVolume(String name, int count);

    /**
     * Like {@link #metricsByVolume} but converted to data objects.
     *
     * @param name  metric name
     * @param type  data class to convert each metric to
     * @param count maximum number of results
     * @param <T>   data type
     * @return up to {@code count} data objects, newest first
     * @throws IllegalArgumentException if a stored metric is not composite or
     *                                  does not fit {@code type}
     */
    default <T> List<T> metricDataByVolume(String name, Class<T> type, int count) {
        return metricsByVolume(name, count).stream()
                .map(metric -> toData(metric, type))
                .toList();
    }

    /**
     * Like {@link #metricsByDate} but converted to data objects.
     *
     * @param name   metric name
     * @param type   data class to convert each metric to
     * @param oldest earliest timestamp, inclusive
     * @param newest latest timestamp, inclusive
     * @param <T>    data type
     * @return matching data objects, newest first
     */
    default <T> List<T> metricDataByDate(String name, Class<T> type, Instant oldest, Instant newest) {
        return metricsByDate(name, oldest, newest).stream()
                .map(metric -> toData(metric, type))
                .toList();
    }

    /**
     * Remove every metric older than {@code before}.
     *
     * @param before cut-off, exclusive
     * @param name   restrict the purge to this metric name, or {@code null}
     *               for all names
     * @return number of metrics removed
     */
    int purgeByDate(Instant before, String name);

    /**
     * Keep only the {@code count} most recent metrics of {@code name}.
     *
     * @param count number of metrics to keep; must not be negative
     * @param name  metric name
     * @return number of metrics removed
     */
    int purgeByVolume(int count, String name);

    /**
     * Restrict subsequent queries to metrics whose metadata value for
     * {@code name} satisfies the comparison. Filters accumulate.
     *
     * @param name  metadata key
     * @param value string or integer to compare against
     * @param op    the comparison
     * @return this store
     */
    MetricStore filterOnMetadata(String name, Object value, Comparison op);

    /**
     * Remove all metadata filters.
     */
    void clearFilters();

    private static <T> T toData(BasicMetric metric, Class<T> type) {
        if (!(metric instanceof CompositeMetric composite)) {
            throw new IllegalArgumentException("Metric '" + metric.getName()
                    + "' is not composite and cannot be converted to " + type.getName());
        }
        return MetricStructures.toStructured(composite, type);
    }
}
