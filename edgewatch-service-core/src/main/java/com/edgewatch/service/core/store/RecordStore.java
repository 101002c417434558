package com.edgewatch.service.core.store;

import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.TelemetryRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public interface RecordStore {

    /**
     * Persists records idempotently. Never throws for store failures; records that could not be written are
     * reported in {@link WriteResult#failed()}.
     */
    WriteResult writeBatch(List<? extends TelemetryRecord> records);

    /** Samples of a series inside {@code [until - window, until]}, ascending by timestamp. */
    List<MetricSample> queryHistory(String seriesKey, String clusterId, Duration window, Instant until);

    /** At most {@code limit} samples, the earliest first. */
    List<MetricSample> querySeries(String clusterId, String seriesKey, Instant from, Instant to, int limit);

    List<String> listSeries(String clusterId, int limit);

    List<LogRecord> queryLogs(String clusterId, Instant from, Instant to, int limit);
}
