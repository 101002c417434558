package com.edgewatch.service.core.decode;

import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.TelemetryRecord;
import com.edgewatch.telemetry.model.TraceSpan;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoded content of one envelope.
 *
 * @param sections discriminators in envelope order, including repeated kinds
 * @param droppedMetricPoints metric points skipped because their type is not retained or their value is not finite
 */
public record NormalizedBatch(
        String clusterId,
        List<MetricSample> metrics,
        List<LogRecord> logs,
        List<TraceSpan> spans,
        List<TelemetryKind> sections,
        int droppedMetricPoints) {

    public NormalizedBatch {
        metrics = List.copyOf(metrics);
        logs = List.copyOf(logs);
        spans = List.copyOf(spans);
        sections = List.copyOf(sections);
    }

    public List<TelemetryRecord> records() {
        List<TelemetryRecord> all = new ArrayList<>(recordCount());
        all.addAll(metrics);
        all.addAll(logs);
        all.addAll(spans);
        return all;
    }

    public int recordCount() {
        return metrics.size() + logs.size() + spans.size();
    }
}
