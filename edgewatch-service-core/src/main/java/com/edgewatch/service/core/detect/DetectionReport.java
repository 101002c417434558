package com.edgewatch.service.core.detect;

import com.edgewatch.telemetry.model.AnomalyEvent;
import com.edgewatch.telemetry.model.SeriesRef;
import java.util.List;

/**
 * Summary of one detection pass.
 *
 * @param evaluated samples that reached a NORMAL or ANOMALOUS verdict
 * @param failedSeries series whose history could not be loaded; their samples were not evaluated
 */
public record DetectionReport(
        List<AnomalyEvent> anomalies, int evaluated, int insufficient, int skipped, List<SeriesRef> failedSeries) {

    public DetectionReport {
        anomalies = List.copyOf(anomalies);
        failedSeries = List.copyOf(failedSeries);
    }

    public static DetectionReport empty() {
        return new DetectionReport(List.of(), 0, 0, 0, List.of());
    }
}
