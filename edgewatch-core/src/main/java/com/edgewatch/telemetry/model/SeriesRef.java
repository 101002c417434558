package com.edgewatch.telemetry.model;

import java.util.Objects;

/** Identity of a metric series within a cluster. */
public record SeriesRef(String clusterId, String seriesKey) {

    public SeriesRef {
        Objects.requireNonNull(clusterId, "clusterId");
        Objects.requireNonNull(seriesKey, "seriesKey");
    }

    public static SeriesRef of(MetricSample sample) {
        return new SeriesRef(sample.clusterId(), sample.seriesKey());
    }

    public static SeriesRef of(AnomalyEvent event) {
        return new SeriesRef(event.clusterId(), event.seriesKey());
    }

    @Override
    public String toString() {
        return clusterId + "/" + seriesKey;
    }
}
