package com.metricsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for a rules YAML document.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * content:
 *   - ruleset:
 *       description: Code coverage
 *       exclusions:
 *         - exclusion: "/CodeCoverage/by_file*test_excluded.py"
 *       rules:
 *         - action: confirm
 *           rule: "/CodeCoverage#overall &gt; 80.0"
 *         - action: validate
 *           rule: "/CodeCoverage#overall &gt;= 85.0"
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule set is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private List<RuleSetEntry> content = new ArrayList<>();

    /**
     * Return the rule sets. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of rule-set entries
     */
    public List<RuleSetEntry> getContent() {
        return Collections.unmodifiableList(content);
    }

    /**
     * Set the rule sets (used by SnakeYAML during deserialization).
     *
     * @param content the rule-set entries
     */
    public void setContent(List<RuleSetEntry> content) {
        this.content = content != null ? new ArrayList<>(content) : new ArrayList<>();
    }

    /**
     * Validate every rule set in this configuration.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid: missing or empty {@code content}, an entry without a
     * {@code ruleset}, a rule set without rules, an unknown action or a
     * malformed rule.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        if (content.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration does not contain any top-level content element");
        }

        List<String> errors = new ArrayList<>();
        for (int i = 0; i < content.size(); i++) {
            RuleSetEntry entry = content.get(i);
            if (entry == null || entry.getRuleset() == null) {
                errors.add("Content entry at index " + i + " has no ruleset element");
                continue;
            }
            errors.addAll(entry.getRuleset().validate());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{content=" + content + '}';
    }
}
