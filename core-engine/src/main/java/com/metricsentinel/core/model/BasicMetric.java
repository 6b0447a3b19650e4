package com.metricsentinel.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Common base of {@link Metric} (leaf) and {@link CompositeMetric} (branch).
 *
 * <p>
 * Every metric can be flattened into a mapping of path strings to values and
 * restored from such a mapping with {@link #fromFlattened(Map)}. A flattened
 * path has the form {@code /root/child/grandchild#leaf}: composite ancestors
 * are joined with {@value #PATH_SEPARATOR} and the final leaf name is
 * introduced by {@value #LEAF_SEPARATOR}.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class BasicMetric {

    /** Separator between composite names in a path. */
    public static final char PATH_SEPARATOR = '/';

    /** Marker introducing the leaf name at the end of a path. */
    public static final char LEAF_SEPARATOR = '#';

    private final String name;

    protected BasicMetric(String name) {
        this.name = Objects.requireNonNull(name, "Metric name must not be null");
    }

    public String getName() {
        return name;
    }

    /**
     * Flatten this metric, and any metrics it contains, into a single map.
     *
     * @return insertion-ordered map of path to value
     */
    public Map<String, Number> flatten() {
        return flatten("");
    }

    /**
     * Flatten this metric beneath the given path prefix.
     *
     * @param prefix path of the enclosing composite, or empty at the root
     * @return insertion-ordered map of path to value
     */
    public abstract Map<String, Number> flatten(String prefix);

    /**
     * Rebuild a metric from path/value pairs produced by {@link #flatten()}.
     *
     * <p>
     * A single entry whose key holds no {@code '#'} yields a bare {@link Metric};
     * anything else yields a {@link CompositeMetric} rooted at the first
     * location segment.
     * </p>
     *
     * @param values flattened path/value pairs; must not be {@code null}
     * @return the equivalent metric
     * @throws IllegalArgumentException if {@code values} is empty, names more
     *                                  than one root, is malformed, or mixes
     *                                  leaf and composite nodes at one position
     */
    public static BasicMetric fromFlattened(Map<String, ? extends Number> values) {
        return FlattenedMetrics.unflatten(values);
    }
}
