package com.metricsentinel.core.config;

/**
 * Wrapper for one {@code - ruleset:} item under {@code content}.
 *
 * @since 1.0.0
 */
public class RuleSetEntry {

    private RuleSetConfig ruleset;

    public RuleSetEntry() {
    }

    public RuleSetEntry(RuleSetConfig ruleset) {
        this.ruleset = ruleset;
    }

    public RuleSetConfig getRuleset() {
        return ruleset;
    }

    public void setRuleset(RuleSetConfig ruleset) {
        this.ruleset = ruleset;
    }

    @Override
    public String toString() {
        return "RuleSetEntry{ruleset=" + ruleset + '}';
    }
}
