package com.metricsentinel.core.model;

import java.util.Map;
import java.util.Objects;

import static com.metricsentinel.core.model.BasicMetric.LEAF_SEPARATOR;
import static com.metricsentinel.core.model.BasicMetric.PATH_SEPARATOR;

/**
 * Inverse of {@link BasicMetric#flatten()}.
 *
 * <p>
 * Each path is split on its single {@code '#'} into a location and a leaf
 * name. The first location segment names the root; remaining segments are
 * walked (and created when absent) as nested composites. The whole batch is
 * rejected on the first conflict, so no partially built tree escapes.
 * </p>
 */
final class FlattenedMetrics {

    private FlattenedMetrics() {
        // utility class - not instantiable
    }

    static BasicMetric unflatten(Map<String, ? extends Number> values) {
        Objects.requireNonNull(values, "Flattened values must not be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Empty value set when constructing metric");
        }
        if (values.size() == 1) {
            Map.Entry<String, ? extends Number> only = values.entrySet().iterator().next();
            if (only.getKey().indexOf(LEAF_SEPARATOR) < 0) {
                return new Metric(only.getKey(), only.getValue());
            }
        }

        CompositeMetric root = null;
        for (Map.Entry<String, ? extends Number> entry : values.entrySet()) {
            root = place(root, entry.getKey(), entry.getValue());
        }
        return root;
    }

    private static CompositeMetric place(CompositeMetric root, String path, Number value) {
        int marker = path.indexOf(LEAF_SEPARATOR);
        if (marker < 0) {
            throw new IllegalArgumentException("Composite metric path must contain one '#': " + path);
        }
        if (path.indexOf(LEAF_SEPARATOR, marker + 1) >= 0) {
            throw new IllegalArgumentException("Composite metric path contains more than one '#': " + path);
        }
        String location = path.substring(0, marker);
        String leafName = path.substring(marker + 1);
        if (location.startsWith(String.valueOf(PATH_SEPARATOR))) {
            location = location.substring(1);
        }
        String[] segments = location.split(String.valueOf(PATH_SEPARATOR), -1);

        if (root == null) {
            root = new CompositeMetric(segments[0]);
        } else if (!segments[0].equals(root.getName())) {
            throw new IllegalArgumentException(
                    "More than one root found: " + root.getName() + " and " + segments[0]);
        }

        CompositeMetric base = root;
        for (int i = 1; i < segments.length; i++) {
            BasicMetric existing = base.child(segments[i]).orElse(null);
            if (existing == null) {
                base = base.add(new CompositeMetric(segments[i]));
            } else if (existing instanceof CompositeMetric composite) {
                base = composite;
            } else {
                throw new IllegalArgumentException("Mixed composite and leaf nodes at same level: " + path);
            }
        }

        if (base.child(leafName).isPresent()) {
            throw new IllegalArgumentException("Mixed composite and leaf nodes at same level: " + path);
        }
        base.add(new Metric(leafName, value));
        return root;
    }
}
