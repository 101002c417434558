package com.edgewatch.telemetry.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One metric point of a series.
 *
 * <p>{@code seriesKey} is the canonical {@code name{label="value",...}} text produced by {@link SeriesKeys}; it is
 * opaque to storage and detection and only compared for equality.
 */
public record MetricSample(
        String clusterId,
        String seriesKey,
        String metricName,
        SortedMap<String, String> labels,
        long timestamp,
        double value,
        MetricKind kind)
        implements TelemetryRecord {

    public MetricSample {
        Objects.requireNonNull(clusterId, "clusterId");
        Objects.requireNonNull(seriesKey, "seriesKey");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(kind, "kind");
        labels = labels == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(labels));
    }

    public static MetricSample of(
            String clusterId,
            String metricName,
            Map<String, String> labels,
            long timestamp,
            double value,
            MetricKind kind) {
        Map<String, String> safeLabels = labels == null ? Map.of() : labels;
        return new MetricSample(
                clusterId,
                SeriesKeys.canonical(metricName, safeLabels),
                metricName,
                new TreeMap<>(safeLabels),
                timestamp,
                value,
                kind);
    }

    @Override
    public RecordType recordType() {
        return RecordType.METRIC;
    }
}
