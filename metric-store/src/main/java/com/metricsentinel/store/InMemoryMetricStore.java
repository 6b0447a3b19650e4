package com.metricsentinel.store;

import com.metricsentinel.core.model.BasicMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * {@link MetricStore} holding snapshots in memory.
 *
 * <p>
 * Each metric is kept in its flattened JSON form, so what comes back out is
 * rebuilt the same way a persistent store would rebuild it. Snapshots with
 * equal timestamps are returned most recently posted first.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every public method is {@code synchronized}.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryMetricStore implements MetricStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryMetricStore.class);

    private static final Comparator<Entry> NEWEST_FIRST = Comparator
            .comparing((Entry e) -> e.snapshot.getTimestamp())
            .thenComparingLong(e -> e.sequence)
            .reversed();

    private final List<Entry> entries = new ArrayList<>();
    private final List<MetadataFilter> filters = new ArrayList<>();
    private long sequence;

    @Override
    public synchronized void post(BasicMetric metric, Instant timestamp, Metadata metadata,
            String projectName, String uuid) {
        Objects.requireNonNull(metric, "Metric must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        MetricSnapshot snapshot = MetricSnapshot.of(metric, timestamp, metadata, projectName, uuid);
        entries.add(new Entry(sequence++, snapshot));
        LOG.debug("Stored metric '{}' at {}", metric.getName(), timestamp);
    }

    @Override
    public synchronized List<BasicMetric> metricsByDate(String name, Instant oldest, Instant newest) {
        Objects.requireNonNull(name, "Metric name must not be null");
        Objects.requireNonNull(oldest, "Oldest timestamp must not be null");
        Objects.requireNonNull(newest, "Newest timestamp must not be null");
        return select(name)
                .filter(e -> !e.snapshot.getTimestamp().isBefore(oldest)
                        && !e.snapshot.getTimestamp().isAfter(newest))
                .map(e -> e.snapshot.toMetric())
                .toList();
    }

    @Override
    public synchronized List<BasicMetric> metricsByVolume(String name, int count) {
        Objects.requireNonNull(name, "Metric name must not be null");
        if (count <= 0) {
            throw new IllegalArgumentException("Count must be positive, got: " + count);
        }
        return select(name)
                .limit(count)
                .map(e -> e.snapshot.toMetric())
                .toList();
    }

    /**
     * @param name metric name
     * @return stored snapshots of {@code name} passing the current filters,
     *         newest first
     */
    public synchronized List<MetricSnapshot> snapshots(String name) {
        Objects.requireNonNull(name, "Metric name must not be null");
        return select(name).map(e -> e.snapshot).toList();
    }

    @Override
    public synchronized int purgeByDate(Instant before, String name) {
        Objects.requireNonNull(before, "Cut-off timestamp must not be null");
        int removed = 0;
        for (Iterator<Entry> it = entries.iterator(); it.hasNext();) {
            MetricSnapshot snapshot = it.next().snapshot;
            if ((name == null || name.equals(snapshot.getName()))
                    && snapshot.getTimestamp().isBefore(before)) {
                it.remove();
                removed++;
            }
        }
        LOG.info("Purged {} metric(s) older than {}{}", removed, before,
                name == null ? "" : " named '" + name + "'");
        return removed;
    }

    @Override
    public synchronized int purgeByVolume(int count, String name) {
        Objects.requireNonNull(name, "Metric name must not be null");
        if (count < 0) {
            throw new IllegalArgumentException("Count must not be negative, got: " + count);
        }
        List<Entry> doomed = entries.stream()
                .filter(e -> e.snapshot.getName().equals(name))
                .sorted(NEWEST_FIRST)
                .skip(count)
                .toList();
        entries.removeAll(doomed);
        LOG.info("Purged {} metric(s) named '{}', keeping the {} most recent", doomed.size(), name, count);
        return doomed.size();
    }

    @Override
    public synchronized InMemoryMetricStore filterOnMetadata(String name, Object value, Comparison op) {
        Objects.requireNonNull(name, "Metadata name must not be null");
        Objects.requireNonNull(value, "Metadata value must not be null");
        Objects.requireNonNull(op, "Comparison must not be null");
        if (!(value instanceof String || value instanceof Integer || value instanceof Long)) {
            throw new IllegalArgumentException("Metadata filter value must be a string or integer, got: " + value);
        }
        filters.add(new MetadataFilter(name, value, op));
        return this;
    }

    @Override
    public synchronized void clearFilters() {
        filters.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    private Stream<Entry> select(String name) {
        return entries.stream()
                .filter(e -> e.snapshot.getName().equals(name))
                .filter(e -> passesFilters(e.snapshot.getMetadata()))
                .sorted(NEWEST_FIRST);
    }

    private boolean passesFilters(Metadata metadata) {
        for (MetadataFilter filter : filters) {
            Object actual = metadata.get(filter.name).orElse(null);
            if (!filter.op.test(actual, filter.value)) {
                return false;
            }
        }
        return true;
    }

    private static final class Entry {
        private final long sequence;
        private final MetricSnapshot snapshot;

        private Entry(long sequence, MetricSnapshot snapshot) {
            this.sequence = sequence;
            this.snapshot = snapshot;
        }
    }

    private static final class MetadataFilter {
        private final String name;
        private final Object value;
        private final Comparison op;

        private MetadataFilter(String name, Object value, Comparison op) {
            this.name = name;
            this.value = value;
            this.op = op;
        }
    }
}
