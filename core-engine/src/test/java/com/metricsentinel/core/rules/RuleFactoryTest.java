package com.metricsentinel.core.rules;

import com.metricsentinel.core.config.RuleEntry;
import com.metricsentinel.core.config.RuleSetConfig;
import com.metricsentinel.core.config.RuleSetEntry;
import com.metricsentinel.core.config.RulesConfig;
import com.metricsentinel.core.config.RulesLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleFactory}.
 */
class RuleFactoryTest {

    @Test
    @DisplayName("Should parse a well-formed rule")
    void shouldParseRule() {
        Rule rule = RuleFactory.parse("/CodeCoverage#overall >= 85.0");

        assertThat(rule.getPattern()).isEqualTo("/CodeCoverage#overall");
        assertThat(rule.getOperation()).isEqualTo(Rule.Evaluation.GREATER_THAN_OR_EQUAL);
        assertThat(rule.getLimit()).isEqualTo(85.0);
    }

    @Test
    @DisplayName("Should tolerate extra whitespace between tokens")
    void shouldTolerateExtraWhitespace() {
        Rule rule = RuleFactory.parse("  *   <   10 ");

        assertThat(rule.getPattern()).isEqualTo("*");
        assertThat(rule.getLimit()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should reject malformed rule text")
    void shouldRejectMalformedRules() {
        for (String text : List.of("/A#x <", "/A#x == 1.0", "/A#x < ten", "/A#x < 1 extra")) {
            assertThatThrownBy(() -> RuleFactory.parse(text))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Must be in format 'pattern [<, >, <=, >=] float-value'");
        }
        assertThatThrownBy(() -> RuleFactory.parse(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("required");
    }

    @Test
    @DisplayName("Should accept plain decimal limits")
    void shouldAcceptDecimalLimits() {
        assertThat(RuleFactory.parse("* < 70").getLimit()).isEqualTo(70.0);
        assertThat(RuleFactory.parse("* < -0.5").getLimit()).isEqualTo(-0.5);
        assertThat(RuleFactory.parse("* < .5").getLimit()).isEqualTo(0.5);
        assertThat(RuleFactory.parse("* < 1e3").getLimit()).isEqualTo(1000.0);
        assertThat(RuleFactory.parse("* < +2.5E-1").getLimit()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Should reject typed suffixes, hex and special float literals")
    void shouldRejectNonDecimalLimits() {
        for (String limit : List.of("70f", "70d", "70.0D", "0x1p3", "0x10", "NaN", "Infinity")) {
            assertThatThrownBy(() -> RuleFactory.parse("/A#x < " + limit))
                    .as(limit)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Must be in format 'pattern [<, >, <=, >=] float-value'");
        }
    }

    @Test
    @DisplayName("Should route confirm rules to alerts and validate rules to validations")
    void shouldRouteRulesByAction() {
        RuleSetConfig ruleset = new RuleSetConfig();
        ruleset.setDescription("routing");
        ruleset.setRules(List.of(
                new RuleEntry("confirm", "/A#x < 1.0"),
                new RuleEntry("VALIDATE", "/A#y > 2.0")));
        RulesConfig config = new RulesConfig();
        config.setContent(List.of(new RuleSetEntry(ruleset)));

        RulesEngine engine = RuleFactory.createEngine(config);

        assertThat(engine.getAlerts()).extracting(Rule::getPattern).containsExactly("/A#x");
        assertThat(engine.getValidations()).extracting(Rule::getPattern).containsExactly("/A#y");
    }

    @Test
    @DisplayName("Should reject a configuration with an unknown action")
    void shouldRejectUnknownAction() {
        RuleSetConfig ruleset = new RuleSetConfig();
        ruleset.setRules(List.of(new RuleEntry("warn", "/A#x < 1.0")));
        RulesConfig config = new RulesConfig();
        config.setContent(List.of(new RuleSetEntry(ruleset)));

        assertThatThrownBy(() -> RuleFactory.createEngine(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid action specified: 'warn'");
    }

    @Test
    @DisplayName("Should create an engine from the default classpath rules")
    void shouldCreateEngineFromDefaultRules() {
        RulesEngine engine = RuleFactory.createEngine(RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE));

        assertThat(engine.getValidations()).hasSize(1);
        assertThat(engine.getAlerts()).isEmpty();
    }
}
