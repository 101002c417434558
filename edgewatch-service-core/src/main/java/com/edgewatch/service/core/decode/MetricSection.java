package com.edgewatch.service.core.decode;

import java.util.List;
import java.util.Map;

/** Metric series as sent by the collector, before kind filtering. */
public record MetricSection(List<Series> series) implements TelemetrySection {

    public MetricSection {
        series = List.copyOf(series);
    }

    @Override
    public TelemetryKind kind() {
        return TelemetryKind.METRICS;
    }

    @Override
    public <R> R accept(SectionVisitor<R> visitor) {
        return visitor.visitMetrics(this);
    }

    /**
     * @param kind the wire point type, lower-cased ("gauge", "counter", "histogram", ...)
     * @param temporality "cumulative" or "delta"; only meaningful for counters
     */
    public record Series(
            String name, Map<String, String> labels, String kind, String temporality, List<Point> points) {}

    /** {@code value} may be NaN or infinite; such points are dropped during normalization. */
    public record Point(long timestamp, double value) {}
}
