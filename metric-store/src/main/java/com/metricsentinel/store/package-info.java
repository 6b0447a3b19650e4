/**
 * Storage of metrics over time: the {@link com.metricsentinel.store.MetricStore}
 * contract, its in-memory implementation and the flattened JSON form metrics
 * are kept in.
 */
package com.metricsentinel.store;
