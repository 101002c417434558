package com.edgewatch.telemetry.model;

/** A normalized telemetry record owned by one cluster. */
public sealed interface TelemetryRecord permits MetricSample, LogRecord, TraceSpan {

    String clusterId();

    /** Epoch milliseconds. */
    long timestamp();

    RecordType recordType();
}
