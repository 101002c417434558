package com.edgewatch.service.core.decode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.service.core.decode.prompb.Label;
import com.edgewatch.service.core.decode.prompb.MetricMetadata;
import com.edgewatch.service.core.decode.prompb.MetricMetadata.MetricType;
import com.edgewatch.service.core.decode.prompb.Sample;
import com.edgewatch.service.core.decode.prompb.TimeSeries;
import com.edgewatch.service.core.decode.prompb.WriteRequest;
import com.edgewatch.telemetry.model.MetricKind;
import com.edgewatch.telemetry.model.MetricSample;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.xerial.snappy.Snappy;

class RemoteWriteDecodingTest {

    private static final String PROTOBUF = "application/x-protobuf";
    private static final long T0 = 1_700_000_000_000L;

    private final EnvelopeDecoder decoder = new EnvelopeDecoder(new ObjectMapper(), new EdgeWatchProperties());

    @Test
    void decodesSnappyCompressedWriteRequest() throws IOException {
        WriteRequest request = WriteRequest.newBuilder()
                .addTimeseries(series(Map.of("__name__", "node_load1", "instance", "n1", "cluster_id", "edge-07"), 0.5))
                .addTimeseries(series(Map.of("__name__", "http_requests_total", "code", "200"), 42))
                .build();

        NormalizedBatch batch = decoder.decode(Snappy.compress(request.toByteArray()), "snappy", PROTOBUF, null);

        assertThat(batch.clusterId()).isEqualTo("edge-07");
        assertThat(batch.sections()).containsExactly(TelemetryKind.METRICS);
        assertThat(batch.metrics()).extracting(MetricSample::seriesKey)
                .containsExactly(
                        "node_load1{cluster_id=\"edge-07\",instance=\"n1\"}", "http_requests_total{code=\"200\"}");
        assertThat(batch.metrics()).extracting(MetricSample::kind).containsExactly(MetricKind.GAUGE, MetricKind.COUNTER);
        assertThat(batch.metrics()).allMatch(m -> m.clusterId().equals("edge-07") && m.timestamp() == T0);
    }

    @Test
    void metadataDecidesKindsAndUnsupportedFamiliesAreDropped() throws IOException {
        WriteRequest request = WriteRequest.newBuilder()
                .addTimeseries(series(Map.of("__name__", "queue_depth"), 3))
                .addTimeseries(series(Map.of("__name__", "rpc_latency_bucket", "le", "0.5"), 7))
                .addTimeseries(series(Map.of("__name__", "rpc_latency_count"), 9))
                .addTimeseries(series(Map.of("__name__", "jobs_done"), 11))
                .addMetadata(metadata("queue_depth", MetricType.GAUGE))
                .addMetadata(metadata("rpc_latency", MetricType.HISTOGRAM))
                .addMetadata(metadata("jobs_done", MetricType.COUNTER))
                .build();

        NormalizedBatch batch = decoder.decode(Snappy.compress(request.toByteArray()), "snappy", PROTOBUF, "edge-01");

        assertThat(batch.metrics()).extracting(MetricSample::metricName).containsExactly("queue_depth", "jobs_done");
        assertThat(batch.metrics()).extracting(MetricSample::kind).containsExactly(MetricKind.GAUGE, MetricKind.COUNTER);
        assertThat(batch.droppedMetricPoints()).isEqualTo(2);
    }

    @Test
    void stalenessMarkersAreDropped() throws IOException {
        WriteRequest request = WriteRequest.newBuilder()
                .addTimeseries(series(Map.of("__name__", "up"), Double.NaN))
                .build();

        NormalizedBatch batch = decoder.decode(Snappy.compress(request.toByteArray()), "snappy", PROTOBUF, "edge-01");

        assertThat(batch.metrics()).isEmpty();
        assertThat(batch.droppedMetricPoints()).isEqualTo(1);
    }

    @Test
    void headerClusterIdWinsOverLabel() throws IOException {
        WriteRequest request = WriteRequest.newBuilder()
                .addTimeseries(series(Map.of("__name__", "up", "cluster_id", "edge-07"), 1))
                .build();

        NormalizedBatch batch = decoder.decode(Snappy.compress(request.toByteArray()), "snappy", PROTOBUF, "edge-99");

        assertThat(batch.clusterId()).isEqualTo("edge-99");
    }

    @Test
    void contentTypeParametersAreIgnored() {
        assertThat(RemoteWriteReader.accepts("application/x-protobuf; proto=prometheus.WriteRequest")).isTrue();
        assertThat(RemoteWriteReader.accepts("Application/X-Protobuf")).isTrue();
        assertThat(RemoteWriteReader.accepts("application/json")).isFalse();
        assertThat(RemoteWriteReader.accepts(null)).isFalse();
    }

    @Test
    void kindsFallBackToNamingConventions() {
        assertThat(RemoteWriteReader.kindOf("http_requests_total", Map.of())).isEqualTo("counter");
        assertThat(RemoteWriteReader.kindOf("rpc_latency_bucket", Map.of())).isEqualTo("histogram");
        assertThat(RemoteWriteReader.kindOf("node_load1", Map.of())).isEqualTo("gauge");
        assertThat(RemoteWriteReader.kindOf("http_requests_total", Map.of("http_requests", MetricType.COUNTER)))
                .isEqualTo("counter");
        assertThat(RemoteWriteReader.kindOf("rpc_duration_sum", Map.of("rpc_duration", MetricType.SUMMARY)))
                .isEqualTo("summary");
    }

    @Test
    void invalidRequestsAreMalformed() throws IOException {
        assertMalformed(Snappy.compress(new byte[] {0x0a, 0x05, 0x01}), "edge-01");

        WriteRequest unnamed = WriteRequest.newBuilder()
                .addTimeseries(series(Map.of("job", "api"), 1))
                .build();
        assertMalformed(Snappy.compress(unnamed.toByteArray()), "edge-01");

        WriteRequest noCluster = WriteRequest.newBuilder()
                .addTimeseries(series(Map.of("__name__", "up"), 1))
                .build();
        assertMalformed(Snappy.compress(noCluster.toByteArray()), null);

        WriteRequest microseconds = WriteRequest.newBuilder()
                .addTimeseries(TimeSeries.newBuilder()
                        .addLabels(Label.newBuilder().setName("__name__").setValue("up"))
                        .addSamples(Sample.newBuilder().setValue(1).setTimestamp(T0 * 1000)))
                .build();
        assertMalformed(Snappy.compress(microseconds.toByteArray()), "edge-01");
    }

    private void assertMalformed(byte[] body, String clusterHint) {
        assertThatThrownBy(() -> decoder.decode(body, "snappy", PROTOBUF, clusterHint))
                .isInstanceOfSatisfying(EnvelopeDecodeException.class, ex ->
                        assertThat(ex.getKind()).isEqualTo(EnvelopeDecodeException.Kind.MALFORMED));
    }

    private static TimeSeries series(Map<String, String> labels, double value) {
        TimeSeries.Builder builder = TimeSeries.newBuilder();
        labels.forEach((name, v) -> builder.addLabels(Label.newBuilder().setName(name).setValue(v)));
        return builder.addSamples(Sample.newBuilder().setValue(value).setTimestamp(T0)).build();
    }

    private static MetricMetadata metadata(String family, MetricType type) {
        return MetricMetadata.newBuilder().setMetricFamilyName(family).setType(type).build();
    }
}
