package com.edgewatch.telemetry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A log line. Attribute order is preserved as received. */
public record LogRecord(String clusterId, long timestamp, String body, Map<String, String> attributes)
        implements TelemetryRecord {

    public LogRecord {
        Objects.requireNonNull(clusterId, "clusterId");
        body = body == null ? "" : body;
        attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public RecordType recordType() {
        return RecordType.LOG;
    }
}
