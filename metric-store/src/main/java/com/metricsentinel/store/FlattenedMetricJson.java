package com.metricsentinel.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.metricsentinel.core.model.BasicMetric;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON form of a flattened metric: an object of path to number.
 *
 * <pre>
 * {"/TestMetric#child1":1,"/TestMetric/child2#grandchild2.1":28832.12993}
 * </pre>
 *
 * <p>
 * Integral values are written without a fraction and read back as
 * {@link Long}; floating values are read back as {@link Double}, so the
 * numeric kind of every leaf survives storage.
 * </p>
 *
 * <p>
 * Non-finite values are written as the bare tokens {@code NaN},
 * {@code Infinity} and {@code -Infinity} and read back as numbers.
 * </p>
 *
 * @since 1.0.0
 */
public final class FlattenedMetricJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .configure(DeserializationFeature.USE_LONG_FOR_INTS, true)
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private FlattenedMetricJson() {
        // utility class - not instantiable
    }

    /**
     * @param metric the metric to encode; must not be {@code null}
     * @return JSON object of its flattened paths
     */
    public static String write(BasicMetric metric) {
        Objects.requireNonNull(metric, "Metric must not be null");
        try {
            return MAPPER.writeValueAsString(metric.flatten());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode metric " + metric.getName(), e);
        }
    }

    /**
     * @param json JSON produced by {@link #write(BasicMetric)}
     * @return the flattened path/value pairs, in document order
     * @throws IllegalArgumentException if the document is not an object of
     *                                  numbers
     */
    public static Map<String, Number> readValues(String json) {
        Objects.requireNonNull(json, "JSON must not be null");
        Map<String, Object> raw;
        try {
            raw = MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid flattened metric document: " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            throw new IllegalArgumentException("Invalid flattened metric document: null");
        }
        Map<String, Number> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof Number number)) {
                throw new IllegalArgumentException("Metric values must be numbers: " + entry.getKey()
                        + "=" + entry.getValue());
            }
            values.put(entry.getKey(), number);
        }
        return values;
    }

    /**
     * @param json JSON produced by {@link #write(BasicMetric)}
     * @return the rebuilt metric
     * @throws IllegalArgumentException if the document is invalid or does not
     *                                  describe a single metric tree
     */
    public static BasicMetric read(String json) {
        return BasicMetric.fromFlattened(readValues(json));
    }
}
