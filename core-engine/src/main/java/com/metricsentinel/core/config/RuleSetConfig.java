package com.metricsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A described group of rules sharing a set of exclusion globs.
 *
 * @since 1.0.0
 */
public class RuleSetConfig {

    /** Used when a rule set carries no description. */
    public static final String NO_DESCRIPTION = "<<none>>";

    private String description = NO_DESCRIPTION;
    private List<ExclusionEntry> exclusions = new ArrayList<>();
    private List<RuleEntry> rules = new ArrayList<>();

    /**
     * @return error messages; empty when the rule set is valid
     */
    List<String> validate() {
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < exclusions.size(); i++) {
            ExclusionEntry exclusion = exclusions.get(i);
            if (exclusion == null || exclusion.getExclusion() == null || exclusion.getExclusion().isBlank()) {
                errors.add("Rule set '" + description + "' has an empty exclusion at index " + i);
            }
        }
        if (rules.isEmpty()) {
            errors.add("Rule set '" + description + "' contains an empty set of rules");
        }
        for (int i = 0; i < rules.size(); i++) {
            RuleEntry rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule set '" + description + "' has a null rule at index " + i);
                continue;
            }
            for (String error : rule.validate()) {
                errors.add("Rule set '" + description + "': " + error);
            }
        }
        return errors;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description != null && !description.isBlank() ? description : NO_DESCRIPTION;
    }

    /**
     * @return unmodifiable list of exclusions
     */
    public List<ExclusionEntry> getExclusions() {
        return Collections.unmodifiableList(exclusions);
    }

    public void setExclusions(List<ExclusionEntry> exclusions) {
        this.exclusions = exclusions != null ? new ArrayList<>(exclusions) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of rules
     */
    public List<RuleEntry> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<RuleEntry> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "RuleSetConfig{description='" + description + "', exclusions=" + exclusions
                + ", rules=" + rules + '}';
    }
}
