/**
 * Threshold rules and the engine that applies them.
 *
 * <p>
 * A {@link com.metricsentinel.core.rules.Rule} binds a glob over flattened
 * leaf paths to a comparison and a limit. The
 * {@link com.metricsentinel.core.rules.RulesEngine} runs alert rules and
 * validation rules over a metric and reports each failing rule as a
 * {@link com.metricsentinel.core.model.ValidationStatus}. Engines are built
 * from configuration via {@link com.metricsentinel.core.rules.RuleFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.rules;
