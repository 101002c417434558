package com.edgewatch.service.core.decode;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.service.core.decode.EnvelopeDecodeException.Kind;
import com.edgewatch.service.core.store.StorageKey;
import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricKind;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.SeriesKeys;
import com.edgewatch.telemetry.model.TraceSpan;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a raw envelope body into a {@link NormalizedBatch}.
 *
 * <p>The body is a JSON object with a {@code sections} array; every section names its telemetry kind in a
 * {@code type} field. All sections are decoded, in order. Bodies sent as {@code application/x-protobuf} are read as
 * a Prometheus remote_write request instead and yield one metrics section. Any structural problem rejects the whole
 * envelope. Metric points of types other than gauges and cumulative counters are dropped and counted.
 */
@Component
@Slf4j
public class EnvelopeDecoder {

    static final String CLUSTER_FIELD = "cluster_id";
    private static final Pattern CLUSTER_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    private final ObjectMapper mapper;
    private final long maxDecompressedBytes;
    private final int maxKeyBytes;

    public EnvelopeDecoder(ObjectMapper mapper, EdgeWatchProperties properties) {
        this.mapper = mapper;
        this.maxDecompressedBytes = properties.getIngest().getMaxDecompressedBytes();
        this.maxKeyBytes = properties.getStore().getMaxKeyBytes();
    }

    /**
     * @param clusterHint cluster id from the request header; takes precedence over the body field
     * @throws EnvelopeDecodeException when the body cannot be decompressed or parsed
     */
    public NormalizedBatch decode(byte[] raw, String contentEncoding, String clusterHint) {
        return decode(raw, contentEncoding, null, clusterHint);
    }

    /**
     * @param contentType {@code application/x-protobuf} selects the Prometheus remote_write format; anything else,
     *     or {@code null}, the JSON envelope
     * @param clusterHint cluster id from the request header; takes precedence over the body
     * @throws EnvelopeDecodeException when the body cannot be decompressed or parsed
     */
    public NormalizedBatch decode(byte[] raw, String contentEncoding, String contentType, String clusterHint) {
        if (raw == null || raw.length == 0) {
            throw EnvelopeDecodeException.malformed("Envelope body is empty");
        }
        byte[] body = ContentDecoding.decode(raw, contentEncoding, maxDecompressedBytes);

        String clusterId;
        List<TelemetrySection> sections;
        if (RemoteWriteReader.accepts(contentType)) {
            RemoteWriteReader.Result request = RemoteWriteReader.read(body);
            clusterId = checkClusterId(clusterHint, request.clusterLabel());
            sections = List.of(request.section());
        } else {
            JsonNode root = readJson(body);
            clusterId = checkClusterId(clusterHint, clusterField(root));
            sections = parseSections(root, clusterId);
        }

        Normalizer normalizer = new Normalizer(clusterId);
        for (TelemetrySection section : sections) {
            section.accept(normalizer);
        }
        NormalizedBatch batch = normalizer.build(sections);
        if (batch.droppedMetricPoints() > 0) {
            log.debug(
                    "Dropped {} unsupported metric points from envelope for cluster {}",
                    batch.droppedMetricPoints(),
                    clusterId);
        }
        return batch;
    }

    private JsonNode readJson(byte[] body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException ex) {
            throw new EnvelopeDecodeException(Kind.MALFORMED, "Envelope is not valid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw EnvelopeDecodeException.malformed("Envelope must be a JSON object");
        }
        return root;
    }

    private List<TelemetrySection> parseSections(JsonNode root, String clusterId) {
        JsonNode sectionsNode = root.path("sections");
        if (!sectionsNode.isArray()) {
            throw EnvelopeDecodeException.malformed("sections must be an array");
        }
        List<TelemetrySection> sections = new ArrayList<>(sectionsNode.size());
        for (int i = 0; i < sectionsNode.size(); i++) {
            sections.add(parseSection(sectionsNode.get(i), clusterId, "sections[" + i + "]"));
        }
        return sections;
    }

    private static String clusterField(JsonNode root) {
        JsonNode field = root.path(CLUSTER_FIELD);
        if (!field.isMissingNode() && !field.isNull() && !field.isTextual()) {
            throw EnvelopeDecodeException.malformed(CLUSTER_FIELD + " must be a string");
        }
        return field.isTextual() ? field.asText() : null;
    }

    private String checkClusterId(String clusterHint, String fromBody) {
        String clusterId = clusterHint != null && !clusterHint.isBlank() ? clusterHint.trim() : null;
        if (clusterId == null && fromBody != null) {
            clusterId = fromBody.trim();
        }
        if (clusterId == null || clusterId.isEmpty()) {
            throw EnvelopeDecodeException.malformed("cluster id is required (x-cluster-id header or cluster_id)");
        }
        if (!CLUSTER_ID.matcher(clusterId).matches()
                || clusterId.getBytes(StandardCharsets.UTF_8).length > maxKeyBytes) {
            throw EnvelopeDecodeException.malformed("Invalid cluster id: " + clusterId);
        }
        return clusterId;
    }

    private TelemetrySection parseSection(JsonNode node, String clusterId, String path) {
        if (node == null || !node.isObject()) {
            throw EnvelopeDecodeException.malformed(path + " must be an object");
        }
        JsonNode typeNode = node.path("type");
        if (!typeNode.isTextual()) {
            throw EnvelopeDecodeException.malformed(path + ".type is required");
        }
        TelemetryKind kind = TelemetryKind.fromWire(typeNode.asText())
                .orElseThrow(() -> EnvelopeDecodeException.malformed(
                        path + ".type has unknown value '" + typeNode.asText() + "'"));
        return switch (kind) {
            case METRICS -> parseMetrics(node, path);
            case LOGS -> parseLogs(node, clusterId, path);
            case TRACES -> parseTraces(node, clusterId, path);
        };
    }

    private MetricSection parseMetrics(JsonNode node, String path) {
        JsonNode seriesNode = requireArray(node, "series", path);
        List<MetricSection.Series> series = new ArrayList<>(seriesNode.size());
        for (int i = 0; i < seriesNode.size(); i++) {
            String seriesPath = path + ".series[" + i + "]";
            JsonNode s = requireObject(seriesNode.get(i), seriesPath);
            Map<String, String> labels = stringMap(s.path("labels"), seriesPath + ".labels");
            String name = optionalText(s, "name", seriesPath);
            if (name == null) {
                name = labels.get(SeriesKeys.NAME_LABEL);
            }
            if (name == null || name.isBlank()) {
                throw EnvelopeDecodeException.malformed(seriesPath + ".name is required");
            }
            checkSeriesNames(name, labels, seriesPath);
            String kind = requireText(s, "kind", seriesPath).toLowerCase(Locale.ROOT);
            String temporality = optionalText(s, "temporality", seriesPath);
            JsonNode samplesNode = requireArray(s, "samples", seriesPath);
            List<MetricSection.Point> points = new ArrayList<>(samplesNode.size());
            for (int j = 0; j < samplesNode.size(); j++) {
                String pointPath = seriesPath + ".samples[" + j + "]";
                JsonNode p = requireObject(samplesNode.get(j), pointPath);
                points.add(new MetricSection.Point(
                        requireTimestamp(p, "timestamp_ms", pointPath), requireValue(p, "value", pointPath)));
            }
            series.add(new MetricSection.Series(
                    name,
                    labels,
                    kind,
                    temporality == null ? "cumulative" : temporality.toLowerCase(Locale.ROOT),
                    points));
        }
        return new MetricSection(series);
    }

    private LogSection parseLogs(JsonNode node, String clusterId, String path) {
        JsonNode recordsNode = requireArray(node, "records", path);
        List<LogRecord> records = new ArrayList<>(recordsNode.size());
        for (int i = 0; i < recordsNode.size(); i++) {
            String recordPath = path + ".records[" + i + "]";
            JsonNode r = requireObject(recordsNode.get(i), recordPath);
            records.add(new LogRecord(
                    clusterId,
                    requireTimestamp(r, "timestamp_ms", recordPath),
                    requireText(r, "body", recordPath),
                    stringMap(r.path("attributes"), recordPath + ".attributes")));
        }
        return new LogSection(records);
    }

    private TraceSection parseTraces(JsonNode node, String clusterId, String path) {
        JsonNode spansNode = requireArray(node, "spans", path);
        List<TraceSpan> spans = new ArrayList<>(spansNode.size());
        for (int i = 0; i < spansNode.size(); i++) {
            String spanPath = path + ".spans[" + i + "]";
            JsonNode s = requireObject(spansNode.get(i), spanPath);
            long start = requireTimestamp(s, "start_ms", spanPath);
            long end = s.has("end_ms") && !s.get("end_ms").isNull() ? requireTimestamp(s, "end_ms", spanPath) : start;
            if (end < start) {
                throw EnvelopeDecodeException.malformed(spanPath + ".end_ms is before start_ms");
            }
            spans.add(new TraceSpan(
                    clusterId,
                    requireText(s, "trace_id", spanPath),
                    requireText(s, "span_id", spanPath),
                    optionalText(s, "parent_span_id", spanPath),
                    optionalText(s, "name", spanPath),
                    start,
                    end,
                    stringMap(s.path("attributes"), spanPath + ".attributes")));
        }
        return new TraceSection(spans);
    }

    private static JsonNode requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw EnvelopeDecodeException.malformed(path + " must be an object");
        }
        return node;
    }

    private static JsonNode requireArray(JsonNode parent, String field, String path) {
        JsonNode node = parent.path(field);
        if (!node.isArray()) {
            throw EnvelopeDecodeException.malformed(path + "." + field + " must be an array");
        }
        return node;
    }

    private static String requireText(JsonNode parent, String field, String path) {
        JsonNode node = parent.path(field);
        if (!node.isTextual()) {
            throw EnvelopeDecodeException.malformed(path + "." + field + " must be a string");
        }
        return node.asText();
    }

    private static String optionalText(JsonNode parent, String field, String path) {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw EnvelopeDecodeException.malformed(path + "." + field + " must be a string");
        }
        return node.asText();
    }

    private static long requireTimestamp(JsonNode parent, String field, String path) {
        JsonNode node = parent.path(field);
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw EnvelopeDecodeException.malformed(path + "." + field + " must be a non-negative integer");
        }
        return checkTimestamp(node.asLong(), path + "." + field);
    }

    /** Millisecond epoch within the range a storage sort key can encode. */
    static long checkTimestamp(long timestamp, String path) {
        if (timestamp < 0 || timestamp > StorageKey.MAX_TIMESTAMP) {
            throw EnvelopeDecodeException.malformed(
                    path + " must be a millisecond timestamp between 0 and " + StorageKey.MAX_TIMESTAMP + ", got "
                            + timestamp);
        }
        return timestamp;
    }

    /** Metric and label names follow the Prometheus data model so that series keys cannot collide. */
    static void checkSeriesNames(String name, Map<String, String> labels, String path) {
        if (!SeriesKeys.isValidMetricName(name)) {
            throw EnvelopeDecodeException.malformed(path + " has an invalid metric name: " + name);
        }
        for (String label : labels.keySet()) {
            if (!SeriesKeys.isValidLabelName(label)) {
                throw EnvelopeDecodeException.malformed(path + " has an invalid label name: " + label);
            }
        }
    }

    /** Accepts JSON numbers and the textual forms Prometheus uses ("1.5", "NaN", "+Inf"). */
    private static double requireValue(JsonNode parent, String field, String path) {
        JsonNode node = parent.path(field);
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            switch (text) {
                case "+Inf", "Inf" -> {
                    return Double.POSITIVE_INFINITY;
                }
                case "-Inf" -> {
                    return Double.NEGATIVE_INFINITY;
                }
                default -> {
                    try {
                        return Double.parseDouble(text);
                    } catch (NumberFormatException ex) {
                        throw EnvelopeDecodeException.malformed(path + "." + field + " is not a number: " + text);
                    }
                }
            }
        }
        throw EnvelopeDecodeException.malformed(path + "." + field + " must be a number");
    }

    private static Map<String, String> stringMap(JsonNode node, String path) {
        if (node.isMissingNode() || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw EnvelopeDecodeException.malformed(path + " must be an object");
        }
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            if (!e.getValue().isTextual()) {
                throw EnvelopeDecodeException.malformed(path + "." + e.getKey() + " must be a string");
            }
            out.put(e.getKey(), e.getValue().asText());
        }
        return out;
    }

    /** Collects normalized records from every section of one envelope. */
    private static final class Normalizer implements SectionVisitor<Void> {
        private final String clusterId;
        private final List<MetricSample> metrics = new ArrayList<>();
        private final List<LogRecord> logs = new ArrayList<>();
        private final List<TraceSpan> spans = new ArrayList<>();
        private int dropped;

        Normalizer(String clusterId) {
            this.clusterId = clusterId;
        }

        @Override
        public Void visitMetrics(MetricSection section) {
            for (MetricSection.Series series : section.series()) {
                MetricKind kind = retainedKind(series);
                if (kind == null) {
                    dropped += series.points().size();
                    continue;
                }
                Map<String, String> labels = new LinkedHashMap<>(series.labels());
                labels.remove(SeriesKeys.NAME_LABEL);
                for (MetricSection.Point point : series.points()) {
                    if (!Double.isFinite(point.value())) {
                        dropped++;
                        continue;
                    }
                    metrics.add(MetricSample.of(
                            clusterId, series.name(), labels, point.timestamp(), point.value(), kind));
                }
            }
            return null;
        }

        @Override
        public Void visitLogs(LogSection section) {
            logs.addAll(section.records());
            return null;
        }

        @Override
        public Void visitTraces(TraceSection section) {
            spans.addAll(section.spans());
            return null;
        }

        private static MetricKind retainedKind(MetricSection.Series series) {
            return switch (series.kind()) {
                case "gauge" -> MetricKind.GAUGE;
                case "counter" -> "cumulative".equals(series.temporality()) ? MetricKind.COUNTER : null;
                default -> null;
            };
        }

        NormalizedBatch build(List<TelemetrySection> sections) {
            List<TelemetryKind> kinds = new ArrayList<>(sections.size());
            for (TelemetrySection section : sections) {
                kinds.add(section.kind());
            }
            return new NormalizedBatch(clusterId, metrics, logs, spans, kinds, dropped);
        }
    }
}
