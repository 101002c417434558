package com.edgewatch.telemetry.model;

import java.util.Objects;

/**
 * A sample classified as anomalous against its series baseline.
 *
 * @param observedValue the gauge value, or the per-second rate for counters
 * @param baselineDeviation the scaled median absolute deviation of the baseline window
 * @param score distance from the median in units of {@code baselineDeviation}; infinite for flat baselines
 */
public record AnomalyEvent(
        String clusterId,
        String seriesKey,
        String metricName,
        MetricKind kind,
        long timestamp,
        double observedValue,
        double baselineMedian,
        double baselineDeviation,
        double score,
        Severity severity) {

    public AnomalyEvent {
        Objects.requireNonNull(clusterId, "clusterId");
        Objects.requireNonNull(seriesKey, "seriesKey");
        Objects.requireNonNull(severity, "severity");
    }
}
