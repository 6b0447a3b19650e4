package com.metricsentinel.core.rules;

import com.metricsentinel.core.model.BasicMetric;
import com.metricsentinel.core.model.CompositeMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A threshold check bound to a glob over the flattened paths of a
 * {@link CompositeMetric}.
 *
 * <p>
 * The pattern is matched against the root-anchored path of each leaf, the
 * same string {@link CompositeMetric#flatten()} produces, e.g.
 * {@code /Performance/by_test#duration}. A pattern of {@code *} alone
 * selects every leaf.
 * </p>
 *
 * <p>
 * The {@link Evaluation} names the bound that must hold:
 * {@code LESS_THAN} with limit {@code 70.0} is satisfied by {@code 69.9} and
 * violated by {@code 70.0}.
 * </p>
 *
 * <p>
 * Rules are immutable and stateless; one instance can validate any number
 * of metrics.
 * </p>
 *
 * @since 1.0.0
 */
public final class Rule {

    private static final Logger LOG = LoggerFactory.getLogger(Rule.class);

    /** Pattern that selects every leaf. */
    public static final String MATCH_ALL = "*";

    /** Comparison a leaf value must satisfy against the limit. */
    public enum Evaluation {
        LESS_THAN("<", ">="),
        GREATER_THAN(">", "<="),
        LESS_THAN_OR_EQUAL("<=", ">"),
        GREATER_THAN_OR_EQUAL(">=", "<");

        private final String symbol;
        private final String violationSymbol;

        Evaluation(String symbol, String violationSymbol) {
            this.symbol = symbol;
            this.violationSymbol = violationSymbol;
        }

        public String getSymbol() {
            return symbol;
        }

        /**
         * @return the operator describing a value that breaks this bound
         */
        public String getViolationSymbol() {
            return violationSymbol;
        }

        /**
         * @param value leaf value
         * @param limit the rule's limit
         * @return {@code true} if the bound holds
         */
        public boolean holds(double value, double limit) {
            return switch (this) {
                case LESS_THAN -> value < limit;
                case GREATER_THAN -> value > limit;
                case LESS_THAN_OR_EQUAL -> value <= limit;
                case GREATER_THAN_OR_EQUAL -> value >= limit;
            };
        }

        /**
         * @param symbol one of {@code <}, {@code >}, {@code <=}, {@code >=}
         * @return the matching evaluation
         * @throws IllegalArgumentException for any other symbol
         */
        public static Evaluation fromSymbol(String symbol) {
            for (Evaluation evaluation : values()) {
                if (evaluation.symbol.equals(symbol)) {
                    return evaluation;
                }
            }
            throw new IllegalArgumentException("Unknown comparison operator: '" + symbol
                    + "'. Supported: <, >, <=, >=");
        }
    }

    private final String pattern;
    private final GlobPattern glob;
    private final Evaluation operation;
    private final double limit;
    private final String description;

    public Rule(String pattern, Evaluation operation, double limit) {
        this(pattern, operation, limit, null);
    }

    /**
     * @param pattern     glob over root-anchored leaf paths; must not be {@code null}
     * @param operation   the bound to enforce; must not be {@code null}
     * @param limit       threshold value
     * @param description report text; derived from the other arguments when
     *                    {@code null} or blank
     */
    public Rule(String pattern, Evaluation operation, double limit, String description) {
        this.pattern = Objects.requireNonNull(pattern, "Rule pattern must not be null");
        this.operation = Objects.requireNonNull(operation, "Rule operation must not be null");
        this.limit = limit;
        this.glob = MATCH_ALL.equals(pattern) ? null : GlobPattern.compile(pattern);
        this.description = description == null || description.isBlank()
                ? pattern + " " + operation.getSymbol() + " " + limit
                : description;
    }

    /**
     * Check every selected leaf of {@code metric} against this rule.
     *
     * <p>
     * Leaves whose path matches any exclusion glob are skipped. An exclusion
     * is tried against both the root-anchored path ({@code /Root/sub#x}) and
     * the relative key ({@code sub#x}).
     * </p>
     *
     * @param metric     the composite to check; must not be {@code null}
     * @param exclusions globs removing paths from consideration; may be
     *                   {@code null}
     * @throws ThresholdViolationException if any selected leaf breaks the bound
     */
    public void validate(CompositeMetric metric, Collection<String> exclusions) {
        Objects.requireNonNull(metric, "Composite metric must not be null");
        List<GlobPattern> excluded = exclusions == null
                ? Collections.emptyList()
                : exclusions.stream().map(GlobPattern::compile).toList();

        List<String> failed = new ArrayList<>();
        StringBuilder message = new StringBuilder();

        for (String key : metric.keys(true)) {
            String rooted = rootedPath(metric, key);
            if (isExcluded(excluded, key, rooted)) {
                LOG.trace("Rule [{}]: '{}' excluded", description, rooted);
                continue;
            }
            if (glob != null && !glob.matches(rooted)) {
                continue;
            }
            double value = metric.metric(key).doubleValue();
            if (!operation.holds(value, limit)) {
                message.append("\n   ").append(rooted)
                        .append(' ').append(operation.getViolationSymbol())
                        .append(' ').append(limit);
                failed.add(key);
            }
        }

        if (!failed.isEmpty()) {
            throw new ThresholdViolationException(message.toString(), metric, failed);
        }
    }

    /**
     * Anchor a relative key under the metric's name, yielding the same path
     * {@link CompositeMetric#flatten()} produces for that leaf.
     *
     * @param metric the composite the key belongs to
     * @param key    relative key such as {@code #cpu} or {@code sub#x}
     * @return the root-anchored path, e.g. {@code /Root#cpu}
     */
    static String rootedPath(CompositeMetric metric, String key) {
        String root = BasicMetric.PATH_SEPARATOR + metric.getName();
        if (key.charAt(0) == BasicMetric.LEAF_SEPARATOR) {
            return root + key;
        }
        return root + BasicMetric.PATH_SEPARATOR + key;
    }

    private static boolean isExcluded(List<GlobPattern> exclusions, String key, String rooted) {
        for (GlobPattern exclusion : exclusions) {
            if (exclusion.matches(rooted) || exclusion.matches(key)) {
                return true;
            }
        }
        return false;
    }

    public String getPattern() {
        return pattern;
    }

    public Evaluation getOperation() {
        return operation;
    }

    public double getLimit() {
        return limit;
    }

    public String getDescription() {
        return description;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Rule that))
            return false;
        return Double.compare(limit, that.limit) == 0
                && pattern.equals(that.pattern)
                && operation == that.operation
                && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, operation, limit, description);
    }

    @Override
    public String toString() {
        return "Rule{" + description + '}';
    }
}
