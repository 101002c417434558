package com.edgewatch.service.core.telemetry;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Component
@Primary
public class IngestTelemetryRegistry implements IngestTelemetry {
    private final LongAdder envelopes = new LongAdder();
    private final LongAdder records = new LongAdder();
    private final LongAdder rejectedCredentials = new LongAdder();
    private final LongAdder droppedMetricPoints = new LongAdder();
    private final LongAdder written = new LongAdder();
    private final LongAdder writeFailures = new LongAdder();
    private final LongAdder duplicates = new LongAdder();
    private final LongAdder chunkRetries = new LongAdder();
    private final LongAdder evaluated = new LongAdder();
    private final LongAdder anomalies = new LongAdder();
    private final LongAdder notificationsSent = new LongAdder();
    private final LongAdder suppressed = new LongAdder();
    private final LongAdder dispatchFailures = new LongAdder();

    private final Map<String, LongAdder> decodeFailuresByKind = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> envelopesByCluster = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> deadlinesByStage = new ConcurrentHashMap<>();

    @Override
    public void recordEnvelope(String clusterId, int recordCount) {
        envelopes.increment();
        records.add(recordCount);
        envelopesByCluster.computeIfAbsent(clusterId, k -> new LongAdder()).increment();
    }

    @Override
    public void recordRejectedCredential() {
        rejectedCredentials.increment();
    }

    @Override
    public void recordDecodeFailure(String kind) {
        decodeFailuresByKind.computeIfAbsent(kind, k -> new LongAdder()).increment();
    }

    @Override
    public void recordDroppedMetricPoints(int count) {
        if (count > 0) {
            droppedMetricPoints.add(count);
        }
    }

    @Override
    public void recordStored(int writtenCount, int failedCount, int duplicateCount) {
        written.add(writtenCount);
        writeFailures.add(failedCount);
        duplicates.add(duplicateCount);
    }

    @Override
    public void recordChunkRetry(String table) {
        chunkRetries.increment();
    }

    @Override
    public void recordDetection(int evaluatedCount, int anomalyCount) {
        evaluated.add(evaluatedCount);
        anomalies.add(anomalyCount);
    }

    @Override
    public void recordDispatch(int sent, int suppressedCount, int failedCount) {
        notificationsSent.add(sent);
        suppressed.add(suppressedCount);
        dispatchFailures.add(failedCount);
    }

    @Override
    public void recordDeadlineExceeded(String stage) {
        deadlinesByStage.computeIfAbsent(stage, k -> new LongAdder()).increment();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                envelopes.sum(),
                records.sum(),
                rejectedCredentials.sum(),
                droppedMetricPoints.sum(),
                written.sum(),
                writeFailures.sum(),
                duplicates.sum(),
                chunkRetries.sum(),
                evaluated.sum(),
                anomalies.sum(),
                notificationsSent.sum(),
                suppressed.sum(),
                dispatchFailures.sum(),
                sums(decodeFailuresByKind),
                sums(envelopesByCluster),
                sums(deadlinesByStage));
    }

    private static Map<String, Long> sums(Map<String, LongAdder> adders) {
        Map<String, Long> out = new TreeMap<>();
        adders.forEach((k, v) -> out.put(k, v.sum()));
        return out;
    }

    public record Snapshot(
            long envelopes,
            long records,
            long rejectedCredentials,
            long droppedMetricPoints,
            long written,
            long writeFailures,
            long duplicates,
            long chunkRetries,
            long evaluated,
            long anomalies,
            long notificationsSent,
            long suppressed,
            long dispatchFailures,
            Map<String, Long> decodeFailuresByKind,
            Map<String, Long> envelopesByCluster,
            Map<String, Long> deadlinesByStage) {}
}
