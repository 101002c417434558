package com.edgewatch.service.core.query;

import com.edgewatch.telemetry.model.MetricKind;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * @param kind {@code null} when the series has no points in range
 * @param step {@code null} for raw samples
 * @param truncated the sample limit was reached, later samples in range were not read
 */
public record SeriesQueryResult(
        String clusterId,
        String seriesKey,
        MetricKind kind,
        Instant from,
        Instant to,
        Duration step,
        List<SeriesPoint> points,
        boolean truncated) {

    public SeriesQueryResult {
        points = List.copyOf(points);
    }
}
