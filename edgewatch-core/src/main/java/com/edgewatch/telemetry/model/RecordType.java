package com.edgewatch.telemetry.model;

public enum RecordType {
    METRIC,
    LOG,
    SPAN
}
