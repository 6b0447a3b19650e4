/**
 * Configuration loading and validation for rule files.
 *
 * <p>
 * Rules are defined in YAML and loaded by
 * {@link com.metricsentinel.core.config.RulesLoader} into a
 * {@link com.metricsentinel.core.config.RulesConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.config;
