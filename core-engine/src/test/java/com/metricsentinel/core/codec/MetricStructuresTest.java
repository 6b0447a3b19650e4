package com.metricsentinel.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.metricsentinel.core.model.BasicMetric;
import com.metricsentinel.core.model.CompositeMetric;
import com.metricsentinel.core.model.Metric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricStructures}.
 */
class MetricStructuresTest {

    @Test
    @DisplayName("Should build a composite from a data object")
    void shouldBuildCompositeFromDataObject() {
        BasicMetric metric = MetricStructures.fromStructured("TestRun", createRun());

        assertThat(metric).isInstanceOf(CompositeMetric.class);
        CompositeMetric composite = (CompositeMetric) metric;
        assertThat(composite.metric("#totalDuration").getValue()).isEqualTo(12.5);
        assertThat(composite.metric("byTest/test_one#calls").getValue()).isEqualTo(3L);
        assertThat(composite.metric("byTest/test_two#duration").getValue()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should skip null properties")
    void shouldSkipNullProperties() {
        TestRunData run = createRun();
        run.setByTest(null);

        CompositeMetric composite = (CompositeMetric) MetricStructures.fromStructured("TestRun", run);

        assertThat(composite.child("byTest")).isEmpty();
    }

    @Test
    @DisplayName("Should build a leaf from a number")
    void shouldBuildLeafFromNumber() {
        assertThat(MetricStructures.fromStructured("cpu", 42)).isEqualTo(new Metric("cpu", 42L));
    }

    @Test
    @DisplayName("Should build a composite from a plain map")
    void shouldBuildCompositeFromMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("cpu", 71.0);
        data.put("disk", Map.of("used", 10));

        CompositeMetric composite = (CompositeMetric) MetricStructures.fromStructured("Performance", data);

        assertThat(composite.flatten()).containsExactly(
                Map.entry("/Performance#cpu", 71.0),
                Map.entry("/Performance/disk#used", 10L));
    }

    @Test
    @DisplayName("Should reject non-numeric scalar values")
    void shouldRejectNonNumericValues() {
        Map<String, Object> data = Map.of("label", "fast");

        assertThatThrownBy(() -> MetricStructures.fromStructured("Bad", data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Type mismatch");
    }

    @Test
    @DisplayName("Should reject a data object without properties")
    void shouldRejectEmptyDataObject() {
        assertThatThrownBy(() -> MetricStructures.fromStructured("Empty", new EmptyData()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("Should convert a composite back into the data object")
    void shouldConvertBackToDataObject() {
        TestRunData original = createRun();
        CompositeMetric composite = (CompositeMetric) MetricStructures.fromStructured("TestRun", original);

        TestRunData restored = MetricStructures.toStructured(composite, TestRunData.class);

        assertThat(restored.getTotalDuration()).isEqualTo(12.5);
        assertThat(restored.getByTest()).containsOnlyKeys("test_one", "test_two");
        assertThat(restored.getByTest().get("test_one").getCalls()).isEqualTo(3L);
        assertThat(restored.getByTest().get("test_two").getDuration()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should convert a composite into a generic map")
    void shouldConvertToGenericMap() {
        CompositeMetric composite = new CompositeMetric("Performance");
        composite.addKeyValue("cpu", 71.0);
        composite.addKeyValue("mem", 12);

        Map<String, Double> values = MetricStructures.toStructured(composite,
                new TypeReference<Map<String, Double>>() {
                });

        assertThat(values).containsEntry("cpu", 71.0).containsEntry("mem", 12.0);
    }

    @Test
    @DisplayName("Should reject a child the data type has no field for")
    void shouldRejectUnknownField() {
        CompositeMetric composite = new CompositeMetric("TestRun");
        composite.addKeyValue("unknown", 1);

        assertThatThrownBy(() -> MetricStructures.toStructured(composite, TestRunData.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has no field named unknown");
    }

    @Test
    @DisplayName("Should reject a leaf where a composite is expected")
    void shouldRejectLeafForCompositeField() {
        CompositeMetric composite = new CompositeMetric("TestRun");
        composite.addKeyValue("byTest", 1);

        assertThatThrownBy(() -> MetricStructures.toStructured(composite, TestRunData.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("found a simple metric");
    }

    @Test
    @DisplayName("Should reject a composite where a number is expected")
    void shouldRejectCompositeForNumericField() {
        CompositeMetric composite = new CompositeMetric("TestRun");
        composite.add(new CompositeMetric("totalDuration")).addKeyValue("x", 1);

        assertThatThrownBy(() -> MetricStructures.toStructured(composite, TestRunData.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("found a composite");
    }

    @Test
    @DisplayName("Should reject Optional fields in the target type")
    void shouldRejectOptionalFields() {
        CompositeMetric composite = new CompositeMetric("Ratio");
        composite.addKeyValue("ratio", 0.5);

        assertThatThrownBy(() -> MetricStructures.toStructured(composite, OptionalData.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Type of field ratio")
                .hasMessageContaining("optional wrappers are not supported");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TestRunData createRun() {
        TestData one = new TestData();
        one.setDuration(1.25);
        one.setCalls(3);
        TestData two = new TestData();
        two.setDuration(2.0);
        two.setCalls(1);

        Map<String, TestData> byTest = new LinkedHashMap<>();
        byTest.put("test_one", one);
        byTest.put("test_two", two);

        TestRunData run = new TestRunData();
        run.setTotalDuration(12.5);
        run.setByTest(byTest);
        return run;
    }

    public static class TestData {
        private double duration;
        private long calls;

        public double getDuration() {
            return duration;
        }

        public void setDuration(double duration) {
            this.duration = duration;
        }

        public long getCalls() {
            return calls;
        }

        public void setCalls(long calls) {
            this.calls = calls;
        }
    }

    public static class TestRunData {
        private double totalDuration;
        private Map<String, TestData> byTest;

        public double getTotalDuration() {
            return totalDuration;
        }

        public void setTotalDuration(double totalDuration) {
            this.totalDuration = totalDuration;
        }

        public Map<String, TestData> getByTest() {
            return byTest;
        }

        public void setByTest(Map<String, TestData> byTest) {
            this.byTest = byTest;
        }
    }

    public static class EmptyData {
    }

    public static class OptionalData {
        private Optional<Double> ratio = Optional.empty();

        public Optional<Double> getRatio() {
            return ratio;
        }

        public void setRatio(Optional<Double> ratio) {
            this.ratio = ratio;
        }
    }
}
