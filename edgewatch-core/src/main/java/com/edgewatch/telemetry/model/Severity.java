package com.edgewatch.telemetry.model;

public enum Severity {
    WARNING,
    CRITICAL
}
