package com.edgewatch.controller.rest;

import com.edgewatch.service.core.query.SeriesPoint;
import com.edgewatch.service.core.query.SeriesQueryResult;
import com.edgewatch.telemetry.model.MetricKind;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Series query response. Values are exact decimals so clients see the stored double unchanged. */
public record SeriesQueryResponse(
        String clusterId,
        String seriesKey,
        MetricKind kind,
        Instant from,
        Instant to,
        Long stepMillis,
        int count,
        boolean truncated,
        List<Point> points) {

    public record Point(long timestamp, BigDecimal value) {}

    static SeriesQueryResponse from(SeriesQueryResult result) {
        List<Point> points = new ArrayList<>(result.points().size());
        for (SeriesPoint p : result.points()) {
            points.add(new Point(p.timestamp(), BigDecimal.valueOf(p.value())));
        }
        return new SeriesQueryResponse(
                result.clusterId(),
                result.seriesKey(),
                result.kind(),
                result.from(),
                result.to(),
                result.step() == null ? null : result.step().toMillis(),
                points.size(),
                result.truncated(),
                points);
    }
}
