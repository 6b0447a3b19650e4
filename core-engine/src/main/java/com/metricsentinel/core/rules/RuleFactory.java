package com.metricsentinel.core.rules;

import com.metricsentinel.core.config.ExclusionEntry;
import com.metricsentinel.core.config.RuleEntry;
import com.metricsentinel.core.config.RuleSetConfig;
import com.metricsentinel.core.config.RuleSetEntry;
import com.metricsentinel.core.config.RulesConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Creates {@link Rule}s from rule text and {@link RulesEngine}s from a
 * loaded {@link RulesConfig}.
 *
 * <p>
 * Rule text has exactly three whitespace-separated tokens:
 * {@code <pattern> <operator> <number>}, where the operator is one of
 * {@code <}, {@code >}, {@code <=}, {@code >=}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFactory.class);

    /** Plain decimal literal, optionally signed, with an optional exponent. */
    private static final Pattern LIMIT = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private RuleFactory() {
        // utility class - not instantiable
    }

    /**
     * Parse one rule.
     *
     * @param ruleText e.g. {@code "/Performance#overall_cpu < 70.0"}; the limit
     *                 is a plain decimal number such as {@code 70}, {@code -0.5}
     *                 or {@code 1e3}
     * @return the rule
     * @throws IllegalArgumentException if the text is missing or malformed
     */
    public static Rule parse(String ruleText) {
        if (ruleText == null || ruleText.isBlank()) {
            throw new IllegalArgumentException("Rule text is required");
        }
        String[] tokens = ruleText.trim().split("\\s+");
        if (tokens.length != 3) {
            throw malformed(ruleText, null);
        }
        Rule.Evaluation operation;
        double limit;
        try {
            operation = Rule.Evaluation.fromSymbol(tokens[1]);
            if (!LIMIT.matcher(tokens[2]).matches()) {
                throw new IllegalArgumentException("Not a decimal number: " + tokens[2]);
            }
            limit = Double.parseDouble(tokens[2]);
        } catch (IllegalArgumentException e) {
            throw malformed(ruleText, e);
        }
        return new Rule(tokens[0], operation, limit);
    }

    /**
     * Build an engine from a configuration, routing {@code confirm} rules to
     * alerts and {@code validate} rules to validations.
     *
     * @param config the configuration; must not be {@code null}
     * @return the populated engine
     * @throws IllegalStateException if the configuration is invalid
     */
    public static RulesEngine createEngine(RulesConfig config) {
        Objects.requireNonNull(config, "Rules configuration must not be null");
        config.validate();

        RulesEngine engine = new RulesEngine();
        for (RuleSetEntry entry : config.getContent()) {
            RuleSetConfig ruleset = entry.getRuleset();
            for (ExclusionEntry exclusion : ruleset.getExclusions()) {
                engine.addExclusion(exclusion.getExclusion());
            }
            for (RuleEntry ruleEntry : ruleset.getRules()) {
                Rule rule = parse(ruleEntry.getRule());
                switch (ruleEntry.getRuleAction()) {
                    case CONFIRM -> engine.addAlert(rule);
                    case VALIDATE -> engine.addValidation(rule);
                }
            }
        }

        LOG.info("Created rules engine with {} alert(s), {} validation(s), {} exclusion(s)",
                engine.getAlerts().size(), engine.getValidations().size(), engine.getExclusions().size());
        return engine;
    }

    private static IllegalArgumentException malformed(String ruleText, Exception cause) {
        return new IllegalArgumentException("Invalid rule '" + ruleText
                + "'. Must be in format 'pattern [<, >, <=, >=] float-value'", cause);
    }
}
