package com.edgewatch.controller.rest;

import com.edgewatch.service.core.ingest.IngestOutcome;
import com.edgewatch.service.core.ingest.IngestReport;
import com.edgewatch.service.core.ingest.IngestRequest;
import com.edgewatch.service.core.ingest.IngestStage;
import com.edgewatch.service.core.ingest.IngestionPipeline;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives telemetry envelopes from edge agents. Requests reach this controller only after the API key check.
 * Prometheus remote_write senders post here too ({@code Content-Type: application/x-protobuf},
 * {@code Content-Encoding: snappy}).
 *
 * <p>200 when everything was stored and 207 when part of the batch could not be stored. 503 when nothing could be
 * stored or the request deadline passed between stages; the {@code status} field tells the two apart.
 */
@RestController
@RequestMapping(path = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
public class IngestController {

    public static final String CLUSTER_HEADER = "x-cluster-id";

    private final IngestionPipeline pipeline;
    private final Clock clock;

    public IngestController(IngestionPipeline pipeline, Clock clock) {
        this.pipeline = pipeline;
        this.clock = clock;
    }

    @PostMapping("/ingest")
    public ResponseEntity<IngestResponse> ingest(
            @RequestHeader(name = CLUSTER_HEADER, required = false) String clusterId,
            @RequestHeader(name = HttpHeaders.CONTENT_ENCODING, required = false) String contentEncoding,
            @RequestHeader(name = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestBody(required = false) byte[] body) {
        IngestReport report = pipeline.ingest(
                new IngestRequest(clusterId, contentEncoding, contentType, body, clock.instant()));
        return ResponseEntity.status(statusFor(report.outcome())).body(IngestResponse.from(report));
    }

    static HttpStatus statusFor(IngestOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> HttpStatus.OK;
            case PARTIAL -> HttpStatus.MULTI_STATUS;
            case STORE_FAILED, TIMED_OUT -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    /** Response body; {@code stage} is the last stage that completed. */
    public record IngestResponse(
            String status,
            IngestStage stage,
            String clusterId,
            int received,
            int droppedMetricPoints,
            int written,
            int duplicates,
            int failed,
            Map<String, Integer> storageFailures,
            int anomalies,
            Integer notificationsSent,
            Integer suppressed,
            Integer dispatchFailures) {

        static IngestResponse from(IngestReport r) {
            Map<String, Integer> failures = new TreeMap<>();
            r.storageFailures().forEach((kind, count) -> failures.put(kind.name(), count));
            IngestStage stage = r.outcome() == IngestOutcome.TIMED_OUT || r.outcome() == IngestOutcome.STORE_FAILED
                    ? r.lastStage()
                    : IngestStage.RESPONDED;
            return new IngestResponse(
                    r.outcome().name().toLowerCase(Locale.ROOT),
                    stage,
                    r.clusterId(),
                    r.metrics() + r.logs() + r.spans(),
                    r.droppedMetricPoints(),
                    r.written(),
                    r.duplicates(),
                    r.failed(),
                    failures,
                    r.anomalies(),
                    r.dispatch() == null ? null : r.dispatch().notificationsSent(),
                    r.dispatch() == null ? null : r.dispatch().suppressed(),
                    r.dispatch() == null ? null : r.dispatch().failed().size());
        }
    }
}
