package com.edgewatch.telemetry.model;

/** Metric point types retained for storage and detection. */
public enum MetricKind {
    GAUGE,
    /** Monotonic cumulative counter. */
    COUNTER
}
