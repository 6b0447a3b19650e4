package com.metricsentinel.core.rules;

import com.metricsentinel.core.model.CompositeMetric;
import com.metricsentinel.core.model.ValidationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RulesEngine}.
 */
class RulesEngineTest {

    @Test
    @DisplayName("Should report a failing alert and no failure when validations hold")
    void shouldClassifyAlertsAndValidations() {
        RulesEngine engine = new RulesEngine();
        engine.addAlert(new Rule("/Root#cpu", Rule.Evaluation.LESS_THAN, 70.0));
        engine.addValidation(new Rule("/Root#mem", Rule.Evaluation.LESS_THAN, 100.0));

        List<ValidationStatus> statuses = engine.validate(createMetric(71.0, 40.0));

        assertThat(statuses).hasSize(1);
        ValidationStatus status = statuses.get(0);
        assertThat(status.getLevel()).isEqualTo(ValidationStatus.Level.ALERT);
        assertThat(status.getOffendingElements()).containsExactly("#cpu");
        assertThat(status.getText()).isEqualTo(RulesEngine.SEPARATOR
                + "ALERT: For rule '/Root#cpu < 70.0':\n\n   /Root#cpu >= 70.0");
    }

    @Test
    @DisplayName("Should yield nothing when every rule holds")
    void shouldYieldNothingWhenAllHold() {
        RulesEngine engine = new RulesEngine();
        engine.addAlert(new Rule("/Root#cpu", Rule.Evaluation.LESS_THAN, 70.0));
        engine.addValidation(new Rule("*", Rule.Evaluation.LESS_THAN, 100.0));

        assertThat(engine.process(createMetric(10.0, 20.0))).isEmpty();
    }

    @Test
    @DisplayName("Should report alerts before validation failures")
    void shouldReportAlertsFirst() {
        RulesEngine engine = new RulesEngine();
        engine.addValidation(new Rule("/Root#mem", Rule.Evaluation.LESS_THAN, 50.0));
        engine.addAlert(new Rule("/Root#cpu", Rule.Evaluation.LESS_THAN, 70.0));

        List<ValidationStatus> statuses = engine.validate(createMetric(90.0, 90.0));

        assertThat(statuses).extracting(ValidationStatus::getLevel)
                .containsExactly(ValidationStatus.Level.ALERT, ValidationStatus.Level.FAILURE);
        assertThat(statuses.get(1).getText()).startsWith(RulesEngine.SEPARATOR + "VALIDATION FAILURE: For rule");
    }

    @Test
    @DisplayName("Should apply exclusions to every rule")
    void shouldApplyExclusions() {
        RulesEngine engine = new RulesEngine();
        engine.addValidation(new Rule("*", Rule.Evaluation.LESS_THAN, 50.0));
        engine.addExclusion("/Root#mem");

        List<ValidationStatus> statuses = engine.validate(createMetric(60.0, 90.0));

        assertThat(statuses).hasSize(1);
        assertThat(statuses.get(0).getOffendingElements()).containsExactly("#cpu");
    }

    @Test
    @DisplayName("Should give the same result when run twice")
    void shouldBeIdempotent() {
        RulesEngine engine = new RulesEngine();
        engine.addAlert(new Rule("/Root#cpu", Rule.Evaluation.LESS_THAN, 70.0));
        engine.addValidation(new Rule("/Root#mem", Rule.Evaluation.LESS_THAN, 50.0));
        CompositeMetric metric = createMetric(90.0, 90.0);

        assertThat(engine.validate(metric)).isEqualTo(engine.validate(metric));
    }

    @Test
    @DisplayName("Should ignore a rule added twice")
    void shouldIgnoreDuplicateRules() {
        RulesEngine engine = new RulesEngine();
        engine.addAlert(new Rule("/Root#cpu", Rule.Evaluation.LESS_THAN, 70.0));
        engine.addAlert(new Rule("/Root#cpu", Rule.Evaluation.LESS_THAN, 70.0));

        assertThat(engine.getAlerts()).hasSize(1);
        assertThat(engine.validate(createMetric(90.0, 0.0))).hasSize(1);
    }

    @Test
    @DisplayName("Should build an engine from a YAML rules file")
    void shouldBuildFromYamlFile() throws URISyntaxException {
        RulesEngine engine = RulesEngine.fromYamlFile(resource("test-rules.yml"));

        assertThat(engine.getAlerts()).hasSize(2);
        assertThat(engine.getValidations()).hasSize(5);
        assertThat(engine.getExclusions()).containsExactly("/CodeCoverage/by_file*test_excluded.py");
    }

    @Test
    @DisplayName("Should flag low coverage and skip excluded files")
    void shouldFlagLowCoverage() throws URISyntaxException {
        RulesEngine engine = RulesEngine.fromYamlFile(resource("test-rules.yml"));
        CompositeMetric coverage = new CompositeMetric("CodeCoverage");
        coverage.addKeyValue("overall", 82.0);
        CompositeMetric byFile = coverage.add(new CompositeMetric("by_file"));
        byFile.addKeyValue("test/test_composite_metric.py", 95.0);
        byFile.addKeyValue("test/test_excluded.py", 10.0);

        List<ValidationStatus> statuses = engine.validate(coverage);

        assertThat(statuses).hasSize(1);
        assertThat(statuses.get(0).getLevel()).isEqualTo(ValidationStatus.Level.FAILURE);
        assertThat(statuses.get(0).getOffendingElements()).containsExactly("#overall");
    }

    @Test
    @DisplayName("Should flag slow performance as an alert and a failure")
    void shouldFlagSlowPerformance() throws URISyntaxException {
        RulesEngine engine = RulesEngine.fromYamlFile(resource("test-rules.yml"));
        CompositeMetric performance = new CompositeMetric("Performance");
        performance.addKeyValue("overall_cpu", 75.0);
        CompositeMetric byTest = performance.add(new CompositeMetric("by_test"));
        byTest.addKeyValue("test_SQLMetricsStore.test_metrics_by_date_with_filter", 12.0);
        byTest.addKeyValue("test_SQLMetricsStore.test_metrics_by_volume_with_filter", 11.0);

        List<ValidationStatus> statuses = engine.validate(performance);

        assertThat(statuses).extracting(ValidationStatus::getLevel)
                .containsExactly(ValidationStatus.Level.ALERT, ValidationStatus.Level.FAILURE);
        assertThat(statuses.get(0).getOffendingElements()).containsExactly("#overall_cpu");
        assertThat(statuses.get(1).getOffendingElements())
                .containsExactly("by_test#test_SQLMetricsStore.test_metrics_by_date_with_filter");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CompositeMetric createMetric(double cpu, double mem) {
        CompositeMetric metric = new CompositeMetric("Root");
        metric.addKeyValue("cpu", cpu);
        metric.addKeyValue("mem", mem);
        return metric;
    }

    private Path resource(String name) throws URISyntaxException {
        return Path.of(getClass().getClassLoader().getResource(name).toURI());
    }
}
