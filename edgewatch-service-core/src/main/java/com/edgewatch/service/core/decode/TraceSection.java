package com.edgewatch.service.core.decode;

import com.edgewatch.telemetry.model.TraceSpan;
import java.util.List;

public record TraceSection(List<TraceSpan> spans) implements TelemetrySection {

    public TraceSection {
        spans = List.copyOf(spans);
    }

    @Override
    public TelemetryKind kind() {
        return TelemetryKind.TRACES;
    }

    @Override
    public <R> R accept(SectionVisitor<R> visitor) {
        return visitor.visitTraces(this);
    }
}
