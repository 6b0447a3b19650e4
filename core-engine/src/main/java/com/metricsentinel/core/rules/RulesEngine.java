package com.metricsentinel.core.rules;

import com.metricsentinel.core.config.RulesLoader;
import com.metricsentinel.core.model.CompositeMetric;
import com.metricsentinel.core.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A composed set of {@link Rule}s applied to {@link CompositeMetric}s.
 *
 * <p>
 * Rules fall in two groups. <em>Alerts</em> flag a concern without rejecting
 * the metric and are reported at {@link ValidationStatus.Level#ALERT};
 * <em>validations</em> reject it and are reported at
 * {@link ValidationStatus.Level#FAILURE}. Exclusion globs remove matching
 * paths from every rule.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Rules and exclusions are kept in insertion order. {@link #process} reports
 * every failing alert before any failing validation, each group in the order
 * its rules were added. Adding an equal rule twice has no effect.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe while being populated. Once built, {@code process} does not
 * modify the engine.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RulesEngine.class);

    static final String SEPARATOR = "\n--------------------------------\n";

    private final Set<Rule> alerts = new LinkedHashSet<>();
    private final Set<Rule> validations = new LinkedHashSet<>();
    private final Set<String> exclusions = new LinkedHashSet<>();

    /**
     * Build an engine from a YAML rules file.
     *
     * @param path the rules file; must not be {@code null}
     * @return the configured engine
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file is not a valid rules document
     */
    public static RulesEngine fromYamlFile(Path path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        return RuleFactory.createEngine(RulesLoader.fromFile(path.toString()));
    }

    /**
     * Add a rule reported as an alert when it fails.
     *
     * @param rule the rule; must not be {@code null}
     */
    public void addAlert(Rule rule) {
        alerts.add(Objects.requireNonNull(rule, "Rule must not be null"));
    }

    /**
     * Add a rule reported as a validation failure when it fails.
     *
     * @param rule the rule; must not be {@code null}
     */
    public void addValidation(Rule rule) {
        validations.add(Objects.requireNonNull(rule, "Rule must not be null"));
    }

    /**
     * Exclude every path matching the glob from all rules.
     *
     * @param pattern glob over root-anchored paths or relative keys
     */
    public void addExclusion(String pattern) {
        exclusions.add(Objects.requireNonNull(pattern, "Exclusion pattern must not be null"));
    }

    public Set<Rule> getAlerts() {
        return Collections.unmodifiableSet(alerts);
    }

    public Set<Rule> getValidations() {
        return Collections.unmodifiableSet(validations);
    }

    public Set<String> getExclusions() {
        return Collections.unmodifiableSet(exclusions);
    }

    /**
     * Lazily evaluate every rule against the metric.
     *
     * <p>
     * Each call works on a snapshot of the engine's rules and yields one
     * status per failing rule. A failing rule never stops the evaluation of
     * the ones after it.
     * </p>
     *
     * @param metric the composite to check; must not be {@code null}
     * @return stream of statuses, alerts first
     */
    public Stream<ValidationStatus> process(CompositeMetric metric) {
        Objects.requireNonNull(metric, "Composite metric must not be null");
        List<Rule> alertRules = List.copyOf(alerts);
        List<Rule> validationRules = List.copyOf(validations);
        List<String> excluded = List.copyOf(exclusions);

        Stream<ValidationStatus> alertStatuses = alertRules.stream()
                .map(rule -> apply(rule, metric, excluded, ValidationStatus.Level.ALERT))
                .flatMap(Optional::stream);
        Stream<ValidationStatus> failureStatuses = validationRules.stream()
                .map(rule -> apply(rule, metric, excluded, ValidationStatus.Level.FAILURE))
                .flatMap(Optional::stream);
        return Stream.concat(alertStatuses, failureStatuses);
    }

    /**
     * Eager form of {@link #process}.
     *
     * @param metric the composite to check
     * @return unmodifiable list of statuses, alerts first
     */
    public List<ValidationStatus> validate(CompositeMetric metric) {
        return process(metric).toList();
    }

    private Optional<ValidationStatus> apply(Rule rule, CompositeMetric metric,
            List<String> excluded, ValidationStatus.Level level) {
        try {
            rule.validate(metric, excluded);
            return Optional.empty();
        } catch (ThresholdViolationException e) {
            LOG.debug("Rule [{}] fired at level {} for {} path(s) of '{}'",
                    rule.getDescription(), level, e.getOffendingElements().size(), metric.getName());
            String heading = level == ValidationStatus.Level.ALERT ? "ALERT" : "VALIDATION FAILURE";
            String text = SEPARATOR + heading + ": For rule '" + rule.getDescription() + "':\n"
                    + e.getMessage();
            return Optional.of(new ValidationStatus(level, text, metric, e.getOffendingElements()));
        }
    }

    @Override
    public String toString() {
        return "RulesEngine{alerts=" + alerts.size()
                + ", validations=" + validations.size()
                + ", exclusions=" + exclusions + '}';
    }
}
