package com.edgewatch.service.core.decode;

/** One discriminated section of an envelope. */
public sealed interface TelemetrySection permits MetricSection, LogSection, TraceSection {

    TelemetryKind kind();

    <R> R accept(SectionVisitor<R> visitor);
}
