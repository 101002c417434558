package com.edgewatch.service.core.query;

import com.edgewatch.service.core.store.RecordStore;
import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricKind;
import com.edgewatch.telemetry.model.MetricSample;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Service;

/** Read path over stored telemetry. Argument errors surface as {@link IllegalArgumentException}. */
@Service
public class SeriesQueryService {

    static final int DEFAULT_LIMIT = 1000;
    static final int MAX_LIMIT = 10_000;
    static final Duration MAX_RANGE = Duration.ofDays(31);

    private final RecordStore store;

    public SeriesQueryService(RecordStore store) {
        this.store = store;
    }

    public SeriesQueryResult querySeries(
            String clusterId, String seriesKey, Instant from, Instant to, Duration step) {
        return querySeries(clusterId, seriesKey, from, to, step, null);
    }

    /**
     * @param limit maximum number of stored samples read, before any step averaging; defaults to
     *     {@value #DEFAULT_LIMIT} and is capped at {@value #MAX_LIMIT}
     */
    public SeriesQueryResult querySeries(
            String clusterId, String seriesKey, Instant from, Instant to, Duration step, Integer limit) {
        requireText(clusterId, "cluster_id");
        requireText(seriesKey, "series_key");
        validateRange(from, to);
        if (step != null && (step.isZero() || step.isNegative())) {
            throw new IllegalArgumentException("step must be positive");
        }
        int max = clampLimit(limit);

        List<MetricSample> samples = store.querySeries(clusterId, seriesKey, from, to, max);
        MetricKind kind = samples.isEmpty() ? null : samples.get(0).kind();
        List<SeriesPoint> points = step == null ? raw(samples) : averaged(samples, step.toMillis());
        return new SeriesQueryResult(clusterId, seriesKey, kind, from, to, step, points, samples.size() >= max);
    }

    public List<String> listSeries(String clusterId, Integer limit) {
        requireText(clusterId, "cluster_id");
        return store.listSeries(clusterId, clampLimit(limit));
    }

    public List<LogRecord> queryLogs(String clusterId, Instant from, Instant to, Integer limit) {
        requireText(clusterId, "cluster_id");
        validateRange(from, to);
        return store.queryLogs(clusterId, from, to, clampLimit(limit));
    }

    private static List<SeriesPoint> raw(List<MetricSample> samples) {
        List<SeriesPoint> out = new ArrayList<>(samples.size());
        for (MetricSample s : samples) {
            out.add(new SeriesPoint(s.timestamp(), s.value()));
        }
        return out;
    }

    static List<SeriesPoint> averaged(List<MetricSample> samples, long stepMillis) {
        Map<Long, double[]> buckets = new TreeMap<>();
        for (MetricSample s : samples) {
            long bucket = Math.floorDiv(s.timestamp(), stepMillis) * stepMillis;
            double[] acc = buckets.computeIfAbsent(bucket, k -> new double[2]);
            acc[0] += s.value();
            acc[1] += 1;
        }
        List<SeriesPoint> out = new ArrayList<>(buckets.size());
        buckets.forEach((bucket, acc) -> out.add(new SeriesPoint(bucket, acc[0] / acc[1])));
        return out;
    }

    private static void validateRange(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        if (Duration.between(from, to).compareTo(MAX_RANGE) > 0) {
            throw new IllegalArgumentException("range must not exceed " + MAX_RANGE.toDays() + " days");
        }
    }

    private static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
