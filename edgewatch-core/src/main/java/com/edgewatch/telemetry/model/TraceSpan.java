package com.edgewatch.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@JsonInclude(Include.NON_NULL)
public record TraceSpan(
        String clusterId,
        String traceId,
        String spanId,
        String parentSpanId,
        String name,
        long startTime,
        long endTime,
        Map<String, String> attributes)
        implements TelemetryRecord {

    public TraceSpan {
        Objects.requireNonNull(clusterId, "clusterId");
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(spanId, "spanId");
        attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** Spans are ordered by their start time. */
    @Override
    public long timestamp() {
        return startTime;
    }

    public long durationMillis() {
        return Math.max(0, endTime - startTime);
    }

    @Override
    public RecordType recordType() {
        return RecordType.SPAN;
    }
}
