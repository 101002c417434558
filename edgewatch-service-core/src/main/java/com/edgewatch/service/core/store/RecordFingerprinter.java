package com.edgewatch.service.core.store;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import com.edgewatch.telemetry.model.LogRecord;
import com.edgewatch.telemetry.model.MetricSample;
import com.edgewatch.telemetry.model.TelemetryRecord;
import com.edgewatch.telemetry.model.TraceSpan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Derives content-based storage keys.
 *
 * <p>Keys depend only on record content: the same record always maps to the same key, so redelivered batches
 * overwrite instead of duplicating. Label-set hashes are cached because series repeat across batches.
 */
@Service
@Slf4j
public class RecordFingerprinter {

    private static final int FINGERPRINT_HEX_CHARS = 32;

    private static final ObjectMapper CANONICAL_JSON =
            new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final Cache<String, String> labelSetHashes;

    public RecordFingerprinter(EdgeWatchProperties properties) {
        EdgeWatchProperties.Store store = properties.getStore();
        this.labelSetHashes = Caffeine.newBuilder()
                .maximumSize(store.getLabelHashCacheSize())
                .expireAfterAccess(store.getLabelHashTtl())
                .build();
        log.info(
                "Initialized label-set hash cache size={} ttl={}.",
                store.getLabelHashCacheSize(),
                store.getLabelHashTtl());
    }

    public StorageKey keyFor(TelemetryRecord record) {
        return switch (record.recordType()) {
            case METRIC -> metricKey((MetricSample) record);
            case LOG -> logKey((LogRecord) record);
            case SPAN -> spanKey((TraceSpan) record);
        };
    }

    /** SHA-256 hex of the canonical (key-sorted) JSON form of a label set. */
    public String labelSetHash(Map<String, String> labels) {
        String canonical = canonical(labels);
        return labelSetHashes.get(canonical, RecordFingerprinter::sha256Hex);
    }

    private StorageKey metricKey(MetricSample sample) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("ts", sample.timestamp());
        node.put("series", sample.seriesKey());
        node.put("labels", labelSetHash(sample.labels()));
        node.put("value", sample.value());
        return key(sample.clusterId(), sample.timestamp(), node);
    }

    private StorageKey logKey(LogRecord record) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("ts", record.timestamp());
        node.put("body", record.body());
        ObjectNode attributes = node.putObject("attributes");
        record.attributes().forEach(attributes::put);
        return key(record.clusterId(), record.timestamp(), node);
    }

    private StorageKey spanKey(TraceSpan span) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("ts", span.startTime());
        node.put("trace", span.traceId());
        node.put("span", span.spanId());
        return key(span.clusterId(), span.startTime(), node);
    }

    private static StorageKey key(String clusterId, long timestamp, ObjectNode identity) {
        if (timestamp < 0 || timestamp > StorageKey.MAX_TIMESTAMP) {
            throw new IllegalArgumentException("timestamp " + timestamp + " does not fit a fixed-width sort key");
        }
        String digest = sha256Hex(write(identity)).substring(0, FINGERPRINT_HEX_CHARS);
        return new StorageKey(clusterId, String.format("%013d#%s", timestamp, digest));
    }

    private static String canonical(Map<String, String> labels) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        labels.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> node.put(entry.getKey(), entry.getValue()));
        return write(node);
    }

    private static String write(ObjectNode node) {
        try {
            return CANONICAL_JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonically encode record identity", e);
        }
    }

    private static String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hashBytes.length * 2);
            for (byte b : hashBytes) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    sb.append('0');
                }
                sb.append(hex);
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
