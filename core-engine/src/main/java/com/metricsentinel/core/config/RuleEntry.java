package com.metricsentinel.core.config;

import com.metricsentinel.core.rules.RuleFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One {@code {action, rule}} item of a rule set.
 *
 * <p>
 * {@code action} is {@code confirm} (alert) or {@code validate} (validation
 * failure); {@code rule} has the form {@code "<pattern> <operator> <number>"},
 * for example {@code "/CodeCoverage#overall >= 85.0"}.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleEntry {

    private String action;
    private String rule;

    public RuleEntry() {
    }

    public RuleEntry(String action, String rule) {
        this.action = action;
        this.rule = rule;
    }

    /**
     * Check the action keyword and the rule text.
     *
     * @return error messages; empty when the entry is valid
     */
    List<String> validate() {
        List<String> errors = new ArrayList<>();
        try {
            RuleAction.fromKeyword(action);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        try {
            RuleFactory.parse(rule);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    public RuleAction getRuleAction() {
        return RuleAction.fromKeyword(action);
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getRule() {
        return rule;
    }

    public void setRule(String rule) {
        this.rule = rule;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleEntry that))
            return false;
        return Objects.equals(action, that.action) && Objects.equals(rule, that.rule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, rule);
    }

    @Override
    public String toString() {
        return "RuleEntry{action='" + action + "', rule='" + rule + "'}";
    }
}
