package com.edgewatch.service.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.edgewatch.service.core.alert.AlertChannelResolver;
import com.edgewatch.service.core.alert.AlertDispatcher;
import com.edgewatch.service.core.alert.AlertMessageFormatter;
import com.edgewatch.service.core.alert.CooldownTracker;
import com.edgewatch.service.core.alert.DeliveryResult;
import com.edgewatch.service.core.alert.NotificationChannel;
import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.service.core.decode.EnvelopeDecodeException;
import com.edgewatch.service.core.decode.EnvelopeDecoder;
import com.edgewatch.service.core.decode.prompb.Label;
import com.edgewatch.service.core.decode.prompb.Sample;
import com.edgewatch.service.core.decode.prompb.TimeSeries;
import com.edgewatch.service.core.decode.prompb.WriteRequest;
import com.edgewatch.service.core.detect.AnomalyDetectionService;
import com.edgewatch.service.core.detect.MadAnomalyDetector;
import com.edgewatch.service.core.store.InMemoryRecordStore;
import com.edgewatch.service.core.store.StorageErrorKind;
import com.edgewatch.service.core.store.WriteResult;
import com.edgewatch.service.core.telemetry.IngestTelemetryRegistry;
import com.edgewatch.telemetry.model.AlertChannelConfig;
import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricKind;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.TelemetryRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.xerial.snappy.Snappy;

class IngestionPipelineTest {

    private static final long T0 = 1_700_000_000_000L;
    private static final Instant RECEIVED = Instant.parse("2026-01-01T00:00:00Z");

    private static final String SPIKE_ENVELOPE =
            """
            {
              "cluster_id": "c1",
              "sections": [
                {"type": "metrics", "series": [
                  {"name": "temp", "labels": {"node": "n1"}, "kind": "gauge",
                   "samples": [{"timestamp_ms": 1700000010000, "value": 500}]},
                  {"name": "histo", "kind": "histogram", "samples": [{"timestamp_ms": 1700000010000, "value": 1}]}
                ]},
                {"type": "logs", "records": [{"timestamp_ms": 1700000010000, "body": "overheating"}]}
              ]
            }
            """;

    private final MutableClock clock = new MutableClock(RECEIVED);
    private final IngestTelemetryRegistry telemetry = new IngestTelemetryRegistry();
    private final List<String> messages = new ArrayList<>();
    private final EdgeWatchProperties properties = new EdgeWatchProperties();

    private SlowStore store;
    private AnomalyDetectionService detection;
    private IngestionPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new SlowStore(clock);
        detection = new AnomalyDetectionService(store, new MadAnomalyDetector(properties), telemetry, properties);
        detection.start();

        NotificationChannel channel = new NotificationChannel() {
            @Override
            public DeliveryResult send(String target, String message) {
                messages.add(message);
                return DeliveryResult.ok();
            }

            @Override
            public String name() {
                return "test";
            }
        };
        AlertDispatcher dispatcher = new AlertDispatcher(
                new AlertChannelResolver(id -> Optional.of(new AlertChannelConfig(id, "-100")), properties),
                new CooldownTracker(properties),
                channel,
                new AlertMessageFormatter(),
                telemetry,
                clock,
                properties);

        pipeline = new IngestionPipeline(
                new EnvelopeDecoder(new ObjectMapper(), properties),
                store,
                detection,
                dispatcher,
                telemetry,
                clock,
                properties);
    }

    @AfterEach
    void tearDown() {
        detection.stop();
    }

    @Test
    void storesDetectsAndAlertsOnSpike() {
        seedHistory(49, 50, 51, 50, 49, 51, 50);

        IngestReport report = pipeline.ingest(request(SPIKE_ENVELOPE));

        assertThat(report.outcome()).isEqualTo(IngestOutcome.SUCCESS);
        assertThat(report.lastStage()).isEqualTo(IngestStage.DISPATCHED);
        assertThat(report.clusterId()).isEqualTo("c1");
        assertThat(report.metrics()).isEqualTo(1);
        assertThat(report.logs()).isEqualTo(1);
        assertThat(report.droppedMetricPoints()).isEqualTo(1);
        assertThat(report.written()).isEqualTo(2);
        assertThat(report.anomalies()).isEqualTo(1);
        assertThat(report.dispatch().notificationsSent()).isEqualTo(1);
        assertThat(messages).singleElement().asString().contains("`c1`").contains("temp{node=\"n1\"}");
        assertThat(telemetry.snapshot().envelopesByCluster()).containsEntry("c1", 1L);
    }

    @Test
    void remoteWriteRequestIsStoredAndEvaluated() throws IOException {
        seedHistory(49, 50, 51, 50, 49, 51, 50);
        WriteRequest request = WriteRequest.newBuilder()
                .addTimeseries(TimeSeries.newBuilder()
                        .addLabels(Label.newBuilder().setName("__name__").setValue("temp"))
                        .addLabels(Label.newBuilder().setName("node").setValue("n1"))
                        .addSamples(Sample.newBuilder().setValue(500).setTimestamp(T0 + 10_000)))
                .build();

        IngestReport report = pipeline.ingest(new IngestRequest(
                "c1", "snappy", "application/x-protobuf", Snappy.compress(request.toByteArray()), RECEIVED));

        assertThat(report.outcome()).isEqualTo(IngestOutcome.SUCCESS);
        assertThat(report.clusterId()).isEqualTo("c1");
        assertThat(report.written()).isEqualTo(1);
        assertThat(report.anomalies()).isEqualTo(1);
        assertThat(messages).singleElement().asString().contains("temp{node=\"n1\"}");
    }

    @Test
    void partialWriteLeavesFailedSamplesOutOfDetection() {
        seedHistory(49, 50, 51, 50, 49, 51, 50);
        store.failOn.add(MetricSample.of("c1", "temp", Map.of("node", "n1"), T0 + 10_000, 500, MetricKind.GAUGE));

        IngestReport report = pipeline.ingest(request(SPIKE_ENVELOPE));

        assertThat(report.outcome()).isEqualTo(IngestOutcome.PARTIAL);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.storageFailures()).containsEntry(StorageErrorKind.THROTTLED, 1);
        assertThat(report.anomalies()).isZero();
        assertThat(messages).isEmpty();
    }

    @Test
    void nothingStoredEndsAfterStoreStageWithoutDetection() {
        seedHistory(49, 50, 51, 50, 49, 51, 50);
        store.failOn.add(MetricSample.of("c1", "temp", Map.of("node", "n1"), T0 + 10_000, 500, MetricKind.GAUGE));
        store.failOn.add(new LogRecord("c1", T0 + 10_000, "overheating", Map.of()));
        int historyQueriesBefore = store.historyQueries.get();

        IngestReport report = pipeline.ingest(request(SPIKE_ENVELOPE));

        assertThat(report.outcome()).isEqualTo(IngestOutcome.STORE_FAILED);
        assertThat(report.lastStage()).isEqualTo(IngestStage.STORED);
        assertThat(report.written()).isZero();
        assertThat(report.failed()).isEqualTo(2);
        assertThat(report.dispatch()).isNull();
        assertThat(store.historyQueries.get()).isEqualTo(historyQueriesBefore);
        assertThat(messages).isEmpty();
    }

    @Test
    void decodeFailureIsRecordedAndRethrownWithoutStoring() {
        assertThatThrownBy(() -> pipeline.ingest(request("{\"sections\": 5}")))
                .isInstanceOf(EnvelopeDecodeException.class)
                .extracting(ex -> ((EnvelopeDecodeException) ex).getKind())
                .isEqualTo(EnvelopeDecodeException.Kind.MALFORMED);

        assertThat(store.records).isEmpty();
        assertThat(telemetry.snapshot().decodeFailuresByKind()).containsEntry("ingest.malformed", 1L);
    }

    @Test
    void deadlinePassedDuringDecodeStopsBeforeStoring() {
        clock.set(RECEIVED.plus(Duration.ofSeconds(11)));

        IngestReport report = pipeline.ingest(request(SPIKE_ENVELOPE));

        assertThat(report.outcome()).isEqualTo(IngestOutcome.TIMED_OUT);
        assertThat(report.lastStage()).isEqualTo(IngestStage.DECODED);
        assertThat(store.records).isEmpty();
        assertThat(telemetry.snapshot().deadlinesByStage()).containsEntry("DECODED", 1L);
    }

    @Test
    void deadlinePassedDuringStoreSkipsDetectionButKeepsWrites() {
        seedHistory(49, 50, 51, 50, 49, 51, 50);
        store.delay = Duration.ofSeconds(11);

        IngestReport report = pipeline.ingest(request(SPIKE_ENVELOPE));

        assertThat(report.outcome()).isEqualTo(IngestOutcome.TIMED_OUT);
        assertThat(report.lastStage()).isEqualTo(IngestStage.STORED);
        assertThat(report.written()).isEqualTo(2);
        assertThat(report.dispatch()).isNull();
        assertThat(messages).isEmpty();
    }

    private void seedHistory(double... values) {
        for (int i = 0; i < values.length; i++) {
            store.records.add(
                    MetricSample.of("c1", "temp", Map.of("node", "n1"), T0 + i * 1000L, values[i], MetricKind.GAUGE));
        }
    }

    private static IngestRequest request(String json) {
        return new IngestRequest(null, null, json.getBytes(StandardCharsets.UTF_8), RECEIVED);
    }

    private static final class SlowStore extends InMemoryRecordStore {
        private final MutableClock clock;
        Duration delay = Duration.ZERO;

        SlowStore(MutableClock clock) {
            this.clock = clock;
        }

        @Override
        public WriteResult writeBatch(List<? extends TelemetryRecord> batch) {
            clock.set(clock.instant().plus(delay));
            return super.writeBatch(batch);
        }
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant instant) {
            this.now = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
