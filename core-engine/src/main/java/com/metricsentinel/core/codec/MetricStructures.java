package com.metricsentinel.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.metricsentinel.core.model.BasicMetric;
import com.metricsentinel.core.model.CompositeMetric;
import com.metricsentinel.core.model.Metric;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts between {@link CompositeMetric} trees and typed data objects.
 *
 * <p>
 * A data object is a JavaBean whose properties are numbers, nested data
 * objects, or {@code Map<String, ...>} of either; {@code Optional} and other
 * reference wrappers are rejected. Numeric properties become
 * {@link Metric} leaves, nested objects and maps become
 * {@link CompositeMetric} children. A map property models a dynamic set of
 * children (for example one entry per test) rather than fixed names.
 * </p>
 *
 * <pre>
 * public class TestRunData {
 *     private double totalDuration;
 *     private Map&lt;String, TestData&gt; byTest;
 *     // getters / setters
 * }
 *
 * BasicMetric metric = MetricStructures.fromStructured("TestRun", data);
 * TestRunData back = MetricStructures.toStructured((CompositeMetric) metric, TestRunData.class);
 * </pre>
 *
 * <p>
 * Property discovery and the final binding use Jackson, so Jackson
 * annotations such as {@code @JsonProperty} are honoured.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricStructures {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.USE_LONG_FOR_INTS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private MetricStructures() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Data object -> metric
    // ---------------------------------------------------------------

    /**
     * Build a metric from a number, a map or a data object.
     *
     * @param name  name of the resulting metric
     * @param value a {@link Number}, a {@link Map} or a data object; must not
     *              be {@code null}
     * @return a {@link Metric} for a number, otherwise a {@link CompositeMetric}
     * @throws IllegalArgumentException if {@code value} (or anything nested in
     *                                  it) is neither numeric nor structured,
     *                                  or a data object has no properties
     */
    public static BasicMetric fromStructured(String name, Object value) {
        Objects.requireNonNull(value, "Structured value must not be null");
        if (value instanceof Number number) {
            return new Metric(name, number);
        }
        if (value instanceof CharSequence || value instanceof Boolean
                || value instanceof Character || value instanceof Enum<?>) {
            throw new IllegalArgumentException("Type mismatch for '" + name
                    + "': expected a number, map or data object but got " + value.getClass().getName());
        }

        Map<?, ?> fields;
        if (value instanceof Map<?, ?> map) {
            fields = map;
        } else {
            try {
                fields = MAPPER.convertValue(value, MAP_TYPE);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Type mismatch for '" + name
                        + "': " + value.getClass().getName() + " is not a data object", e);
            }
            if (fields == null || fields.isEmpty()) {
                throw new IllegalArgumentException("Supplied metrics data object is empty: "
                        + value.getClass().getName());
            }
        }

        CompositeMetric composite = new CompositeMetric(name);
        for (Map.Entry<?, ?> field : fields.entrySet()) {
            if (field.getValue() == null) {
                continue;
            }
            composite.add(fromStructured(String.valueOf(field.getKey()), field.getValue()));
        }
        return composite;
    }

    // ---------------------------------------------------------------
    // Metric -> data object
    // ---------------------------------------------------------------

    /**
     * Convert a composite into an instance of the given data type.
     *
     * @param metric the composite; must not be {@code null}
     * @param type   target data class
     * @param <T>    target type
     * @return the populated data object
     * @throws IllegalArgumentException if the composite's shape does not fit
     *                                  the type
     */
    public static <T> T toStructured(CompositeMetric metric, Class<T> type) {
        Objects.requireNonNull(type, "Target type must not be null");
        return toStructured(metric, MAPPER.getTypeFactory().constructType(type));
    }

    /**
     * Convert a composite into a generic target such as
     * {@code Map<String, Double>}.
     *
     * @param metric the composite; must not be {@code null}
     * @param type   target type reference
     * @param <T>    target type
     * @return the populated value
     * @throws IllegalArgumentException if the composite's shape does not fit
     *                                  the type
     */
    public static <T> T toStructured(CompositeMetric metric, TypeReference<T> type) {
        Objects.requireNonNull(type, "Target type must not be null");
        return toStructured(metric, MAPPER.getTypeFactory().constructType(type));
    }

    private static <T> T toStructured(CompositeMetric metric, JavaType type) {
        Objects.requireNonNull(metric, "Composite metric must not be null");
        Map<String, Object> tree = toTree(metric, type);
        return MAPPER.convertValue(tree, type);
    }

    private static Map<String, Object> toTree(CompositeMetric metric, JavaType type) {
        Map<String, Object> tree = new LinkedHashMap<>();
        if (type.isMapLikeType()) {
            JavaType valueType = type.getContentType();
            for (BasicMetric child : metric.children()) {
                tree.put(child.getName(), toField(child, valueType, type));
            }
            return tree;
        }
        if (!isDataType(type)) {
            throw new IllegalArgumentException("Type mismatch: composite metric '" + metric.getName()
                    + "' cannot be converted to " + type);
        }

        Map<String, JavaType> properties = describe(type);
        for (BasicMetric child : metric.children()) {
            JavaType fieldType = properties.get(child.getName());
            if (fieldType == null) {
                throw new IllegalArgumentException("Given data type " + type.getRawClass().getName()
                        + " has no field named " + child.getName());
            }
            tree.put(child.getName(), toField(child, fieldType, type));
        }
        return tree;
    }

    private static Object toField(BasicMetric child, JavaType target, JavaType owner) {
        if (target.isReferenceType() || Optional.class.isAssignableFrom(target.getRawClass())) {
            throw new IllegalArgumentException("Type of field " + child.getName() + " in "
                    + owner.getRawClass().getName() + " is invalid: " + target
                    + " (optional wrappers are not supported)");
        }
        if (isNumeric(target)) {
            if (!(child instanceof Metric metric)) {
                throw new IllegalArgumentException("Type mismatch in field " + child.getName() + " of "
                        + owner.getRawClass().getName() + ": expected a simple metric but found a composite");
            }
            return metric.getValue();
        }
        if (!(child instanceof CompositeMetric composite)) {
            throw new IllegalArgumentException("Type mismatch in field " + child.getName() + " of "
                    + owner.getRawClass().getName() + ": expected a composite metric for " + target
                    + " but found a simple metric");
        }
        if (target.isMapLikeType() || isDataType(target)) {
            return toTree(composite, target);
        }
        throw new IllegalArgumentException("Type of field " + child.getName() + " in "
                + owner.getRawClass().getName() + " is invalid: " + target);
    }

    private static Map<String, JavaType> describe(JavaType type) {
        BeanDescription description = MAPPER.getDeserializationConfig().introspect(type);
        Map<String, JavaType> properties = new LinkedHashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            properties.put(property.getName(), property.getPrimaryType());
        }
        return properties;
    }

    private static boolean isNumeric(JavaType type) {
        Class<?> raw = type.getRawClass();
        if (raw.isPrimitive()) {
            return raw != boolean.class && raw != char.class && raw != void.class;
        }
        return Number.class.isAssignableFrom(raw);
    }

    private static boolean isDataType(JavaType type) {
        Class<?> raw = type.getRawClass();
        return !type.isContainerType()
                && !type.isEnumType()
                && !raw.isPrimitive()
                && !raw.isArray()
                && !raw.getName().startsWith("java.");
    }
}
