package com.metricsentinel.core.config;

import java.util.Locale;

/**
 * What a rule in a rules file does when it fails.
 *
 * @since 1.0.0
 */
public enum RuleAction {

    /** Report an alert; the metric is still accepted. */
    CONFIRM("confirm"),

    /** Report a validation failure; the metric is rejected. */
    VALIDATE("validate");

    private final String keyword;

    RuleAction(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * @param keyword {@code confirm} or {@code validate}
     * @return the matching action
     * @throws IllegalArgumentException for any other keyword
     */
    public static RuleAction fromKeyword(String keyword) {
        if (keyword != null) {
            String normalized = keyword.trim().toLowerCase(Locale.ROOT);
            for (RuleAction action : values()) {
                if (action.keyword.equals(normalized)) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Invalid action specified: '" + keyword
                + "'. Supported: confirm, validate");
    }
}
