package com.edgewatch.service.core.detect;

import com.edgewatch.service.core.store.RecordStore;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.SeriesRef;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * History cache for one detection pass. Each series is loaded once, covering the look-back window of every
 * batch sample of that series. Lives only as long as the call that created it.
 */
final class DetectionSession {

    private final RecordStore store;
    private final Duration window;
    private final Map<SeriesRef, List<MetricSample>> histories = new ConcurrentHashMap<>();

    DetectionSession(RecordStore store, Duration window) {
        this.store = store;
        this.window = window;
    }

    /** Loads history spanning {@code [earliest - window, latest]} for the series, ascending by timestamp. */
    List<MetricSample> load(SeriesRef series, long earliest, long latest) {
        return histories.computeIfAbsent(series, ref -> {
            Duration span = window.plusMillis(Math.max(0L, latest - earliest));
            List<MetricSample> loaded = new ArrayList<>(
                    store.queryHistory(ref.seriesKey(), ref.clusterId(), span, Instant.ofEpochMilli(latest)));
            loaded.sort(Comparator.comparingLong(MetricSample::timestamp));
            return List.copyOf(loaded);
        });
    }

    /** History points inside the window that ends just before {@code sample}. */
    List<MetricSample> historyBefore(MetricSample sample, List<MetricSample> loaded) {
        long from = sample.timestamp() - window.toMillis();
        List<MetricSample> out = new ArrayList<>();
        for (MetricSample h : loaded) {
            if (h.timestamp() >= from && h.timestamp() < sample.timestamp()) {
                out.add(h);
            }
        }
        return out;
    }
}
