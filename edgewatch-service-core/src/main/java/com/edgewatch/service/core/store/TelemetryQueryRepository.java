package com.edgewatch.service.core.store;

import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricSample;
import java.time.Instant;
import java.util.List;

/** Read side of the record store. */
public interface TelemetryQueryRepository {

    /** The first {@code limit} samples of one series with {@code from <= timestamp <= to}, ascending by timestamp. */
    List<MetricSample> findSamples(String clusterId, String seriesKey, Instant from, Instant to, int limit);

    List<String> findSeriesKeys(String clusterId, int limit);

    /** Log records with {@code from <= timestamp <= to}, ascending by timestamp. */
    List<LogRecord> findLogs(String clusterId, Instant from, Instant to, int limit);
}
