package com.edgewatch.service.core.ingest;

import com.edgewatch.service.core.alert.AlertDispatcher;
import com.edgewatch.service.core.alert.DispatchResult;
import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.service.core.decode.EnvelopeDecodeException;
import com.edgewatch.service.core.decode.EnvelopeDecoder;
import com.edgewatch.service.core.decode.NormalizedBatch;
import com.edgewatch.service.core.detect.AnomalyDetectionService;
import com.edgewatch.service.core.detect.DetectionReport;
import com.edgewatch.service.core.store.RecordStore;
import com.edgewatch.service.core.store.WriteResult;
import com.edgewatch.service.core.telemetry.IngestTelemetry;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.TelemetryRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs an authenticated envelope through decode, store, detect and dispatch.
 *
 * <p>The request deadline is checked between stages only; a stage that has started always finishes. Records the
 * store could not write are left out of detection; when none could be written the request ends after the store
 * stage.
 */
@Service
@Slf4j
public class IngestionPipeline {

    private final EnvelopeDecoder decoder;
    private final RecordStore store;
    private final AnomalyDetectionService detection;
    private final AlertDispatcher dispatcher;
    private final IngestTelemetry telemetry;
    private final Clock clock;
    private final Duration deadline;

    public IngestionPipeline(
            EnvelopeDecoder decoder,
            RecordStore store,
            AnomalyDetectionService detection,
            AlertDispatcher dispatcher,
            IngestTelemetry telemetry,
            Clock clock,
            EdgeWatchProperties properties) {
        this.decoder = decoder;
        this.store = store;
        this.detection = detection;
        this.dispatcher = dispatcher;
        this.telemetry = telemetry;
        this.clock = clock;
        this.deadline = properties.getIngest().getDeadline();
    }

    /**
     * @throws EnvelopeDecodeException when the envelope cannot be decoded; nothing has been stored
     */
    public IngestReport ingest(IngestRequest request) {
        Instant receivedAt = request.receivedAt() != null ? request.receivedAt() : clock.instant();
        Instant expiresAt = receivedAt.plus(deadline);

        NormalizedBatch batch;
        try {
            batch = decoder.decode(
                    request.body(), request.contentEncoding(), request.contentType(), request.clusterHint());
        } catch (EnvelopeDecodeException ex) {
            telemetry.recordDecodeFailure(ex.getKind().code());
            log.warn(
                    "Rejected envelope (cluster hint {}): {} {}",
                    request.clusterHint(),
                    ex.getKind(),
                    ex.getMessage());
            throw ex;
        }
        telemetry.recordEnvelope(batch.clusterId(), batch.recordCount());
        telemetry.recordDroppedMetricPoints(batch.droppedMetricPoints());
        log.debug(
                "Decoded envelope cluster={} sections={} metrics={} logs={} spans={} dropped={}",
                batch.clusterId(),
                batch.sections(),
                batch.metrics().size(),
                batch.logs().size(),
                batch.spans().size(),
                batch.droppedMetricPoints());

        if (expired(expiresAt, IngestStage.DECODED)) {
            return report(IngestOutcome.TIMED_OUT, IngestStage.DECODED, batch, WriteResult.empty(), 0, null);
        }

        WriteResult written = store.writeBatch(batch.records());
        if (!written.isComplete()) {
            log.warn(
                    "Partial write for cluster {}: {} written, {} failed {}",
                    batch.clusterId(),
                    written.written(),
                    written.failed().size(),
                    written.failuresByKind());
        }
        if (written.written() == 0 && !written.failed().isEmpty()) {
            return report(IngestOutcome.STORE_FAILED, IngestStage.STORED, batch, written, 0, null);
        }
        IngestOutcome outcome = written.isComplete() ? IngestOutcome.SUCCESS : IngestOutcome.PARTIAL;

        if (expired(expiresAt, IngestStage.STORED)) {
            return report(IngestOutcome.TIMED_OUT, IngestStage.STORED, batch, written, 0, null);
        }

        DetectionReport detected = detection.detect(storedMetrics(batch, written));

        if (expired(expiresAt, IngestStage.DETECTED)) {
            return report(
                    IngestOutcome.TIMED_OUT, IngestStage.DETECTED, batch, written, detected.anomalies().size(), null);
        }

        DispatchResult dispatched = dispatcher.dispatch(detected.anomalies());
        return report(outcome, IngestStage.DISPATCHED, batch, written, detected.anomalies().size(), dispatched);
    }

    private static List<MetricSample> storedMetrics(NormalizedBatch batch, WriteResult written) {
        if (written.isComplete()) {
            return batch.metrics();
        }
        Set<TelemetryRecord> failed = written.failedRecords();
        List<MetricSample> out = new ArrayList<>(batch.metrics().size());
        for (MetricSample sample : batch.metrics()) {
            if (!failed.contains(sample)) {
                out.add(sample);
            }
        }
        return out;
    }

    private boolean expired(Instant expiresAt, IngestStage completed) {
        if (clock.instant().isAfter(expiresAt)) {
            log.warn("Ingest deadline of {} exceeded after stage {}; skipping remaining stages", deadline, completed);
            telemetry.recordDeadlineExceeded(completed.name());
            return true;
        }
        return false;
    }

    private static IngestReport report(
            IngestOutcome outcome,
            IngestStage lastStage,
            NormalizedBatch batch,
            WriteResult written,
            int anomalies,
            DispatchResult dispatch) {
        return new IngestReport(
                outcome,
                lastStage,
                batch.clusterId(),
                batch.metrics().size(),
                batch.logs().size(),
                batch.spans().size(),
                batch.droppedMetricPoints(),
                written.written(),
                written.duplicates(),
                written.failed().size(),
                written.failed().isEmpty() ? Map.of() : written.failuresByKind(),
                anomalies,
                dispatch);
    }
}
