/**
 * Conversion between composite metrics and typed data objects.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.codec;
