package com.edgewatch.service.core.telemetry;

/** Counters describing what the ingestion pipeline did. */
public interface IngestTelemetry {
    void recordEnvelope(String clusterId, int records);

    void recordRejectedCredential();

    void recordDecodeFailure(String kind);

    void recordDroppedMetricPoints(int count);

    void recordStored(int written, int failed, int duplicates);

    void recordChunkRetry(String table);

    void recordDetection(int evaluated, int anomalies);

    void recordDispatch(int notificationsSent, int suppressed, int failed);

    void recordDeadlineExceeded(String stage);
}
