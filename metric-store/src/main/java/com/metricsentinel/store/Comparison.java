package com.metricsentinel.store;

/**
 * Comparison applied when filtering stored metrics on a metadata value.
 *
 * <p>
 * Numbers compare numerically and strings lexicographically. A number is
 * never equal to, less than or greater than a string.
 * </p>
 *
 * @since 1.0.0
 */
public enum Comparison {
    EQUAL("=="),
    NOT_EQUAL("<>"),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN_OR_EQUAL(">=");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @param actual   the stored metadata value, or {@code null} if absent
     * @param expected the value to compare against
     * @return {@code true} if {@code actual <op> expected} holds
     */
    public boolean test(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        Integer order = compare(actual, expected);
        if (order == null) {
            return this == NOT_EQUAL;
        }
        return switch (this) {
            case EQUAL -> order == 0;
            case NOT_EQUAL -> order != 0;
            case LESS_THAN -> order < 0;
            case GREATER_THAN -> order > 0;
            case LESS_THAN_OR_EQUAL -> order <= 0;
            case GREATER_THAN_OR_EQUAL -> order >= 0;
        };
    }

    private static Integer compare(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (actual instanceof String a && expected instanceof String b) {
            return a.compareTo(b);
        }
        return null;
    }
}
