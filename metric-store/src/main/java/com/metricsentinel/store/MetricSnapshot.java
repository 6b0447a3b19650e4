package com.metricsentinel.store;

import com.metricsentinel.core.model.BasicMetric;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One stored metric: its flattened JSON payload plus timestamp and
 * descriptive data.
 *
 * @since 1.0.0
 */
public final class MetricSnapshot {

    private final String name;
    private final Instant timestamp;
    private final String payload;
    private final Metadata metadata;
    private final String projectName;
    private final String uuid;

    public MetricSnapshot(String name, Instant timestamp, String payload, Metadata metadata,
            String projectName, String uuid) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.metadata = metadata != null ? metadata : Metadata.empty();
        this.projectName = projectName;
        this.uuid = uuid;
    }

    /**
     * Capture a metric as a snapshot.
     *
     * @param metric    the metric; must not be {@code null}
     * @param timestamp when the metric was taken
     * @param metadata  optional metadata
     * @param projectName optional project name
     * @param uuid      optional correlation id
     * @return the snapshot
     */
    public static MetricSnapshot of(BasicMetric metric, Instant timestamp, Metadata metadata,
            String projectName, String uuid) {
        Objects.requireNonNull(metric, "Metric must not be null");
        return new MetricSnapshot(metric.getName(), timestamp, FlattenedMetricJson.write(metric),
                metadata, projectName, uuid);
    }

    /**
     * @return the metric rebuilt from the stored payload
     */
    public BasicMetric toMetric() {
        return FlattenedMetricJson.read(payload);
    }

    public String getName() {
        return name;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getPayload() {
        return payload;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public Optional<String> getProjectName() {
        return Optional.ofNullable(projectName);
    }

    public Optional<String> getUuid() {
        return Optional.ofNullable(uuid);
    }

    @Override
    public String toString() {
        return "MetricSnapshot{" +
                "name='" + name + '\'' +
                ", timestamp=" + timestamp +
                ", projectName='" + projectName + '\'' +
                ", uuid='" + uuid + '\'' +
                '}';
    }
}
