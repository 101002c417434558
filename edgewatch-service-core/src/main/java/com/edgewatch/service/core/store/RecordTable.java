package com.edgewatch.service.core.store;

import com.edgewatch.telemetry.model.RecordType;

/** Logical tables of the record store. */
public enum RecordTable {
    METRIC_SAMPLES("metric_samples"),
    LOG_RECORDS("log_records"),
    TRACE_SPANS("trace_spans");

    private final String tableName;

    RecordTable(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    public static RecordTable of(RecordType type) {
        return switch (type) {
            case METRIC -> METRIC_SAMPLES;
            case LOG -> LOG_RECORDS;
            case SPAN -> TRACE_SPANS;
        };
    }
}
