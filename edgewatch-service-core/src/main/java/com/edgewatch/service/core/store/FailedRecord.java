package com.edgewatch.service.core.store;

import com.edgewatch.telemetry.model.TelemetryRecord;

public record FailedRecord(TelemetryRecord record, StorageErrorKind kind, String detail) {}
