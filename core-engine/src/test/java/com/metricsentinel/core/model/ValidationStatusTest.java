package com.metricsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ValidationStatus}.
 */
class ValidationStatusTest {

    @Test
    @DisplayName("Should map each offending path to the parent metric")
    void shouldMapOffendingPathsToParent() {
        CompositeMetric parent = new CompositeMetric("Root");
        parent.addKeyValue("cpu", 71.0);
        parent.addKeyValue("mem", 90);

        ValidationStatus status = new ValidationStatus(ValidationStatus.Level.ALERT, "text",
                parent, List.of("#cpu", "#mem"));

        assertThat(status.offendingMetrics()).containsOnlyKeys("#cpu", "#mem");
        assertThat(status.offendingMetrics().values()).allMatch(m -> m == parent);
        assertThat(parent.element("#cpu")).isEqualTo(new Metric("cpu", 71.0));
    }

    @Test
    @DisplayName("Should keep offending elements immutable and de-duplicated")
    void shouldKeepOffendingElementsImmutable() {
        ValidationStatus status = new ValidationStatus(ValidationStatus.Level.FAILURE, "text",
                new CompositeMetric("Root"), List.of("#a", "#a", "#b"));

        assertThat(status.getOffendingElements()).containsExactly("#a", "#b");
        assertThatThrownBy(() -> status.getOffendingElements().add("#c"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should expose lowercase level labels")
    void shouldExposeLevelLabels() {
        assertThat(ValidationStatus.Level.IMPROVEMENT.getLabel()).isEqualTo("improvement");
        assertThat(ValidationStatus.Level.ALERT.getLabel()).isEqualTo("alert");
        assertThat(ValidationStatus.Level.FAILURE.getLabel()).isEqualTo("failure");
    }
}
