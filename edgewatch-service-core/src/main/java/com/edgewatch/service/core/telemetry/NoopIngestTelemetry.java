package com.edgewatch.service.core.telemetry;

public class NoopIngestTelemetry implements IngestTelemetry {
    @Override
    public void recordEnvelope(String clusterId, int records) {}

    @Override
    public void recordRejectedCredential() {}

    @Override
    public void recordDecodeFailure(String kind) {}

    @Override
    public void recordDroppedMetricPoints(int count) {}

    @Override
    public void recordStored(int written, int failed, int duplicates) {}

    @Override
    public void recordChunkRetry(String table) {}

    @Override
    public void recordDetection(int evaluated, int anomalies) {}

    @Override
    public void recordDispatch(int notificationsSent, int suppressed, int failed) {}

    @Override
    public void recordDeadlineExceeded(String stage) {}
}
