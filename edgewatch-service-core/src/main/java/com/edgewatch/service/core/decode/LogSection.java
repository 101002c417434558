package com.edgewatch.service.core.decode;

import com.edgewatch.telemetry.model.LogRecord;
import java.util.List;

public record LogSection(List<LogRecord> records) implements TelemetrySection {

    public LogSection {
        records = List.copyOf(records);
    }

    @Override
    public TelemetryKind kind() {
        return TelemetryKind.LOGS;
    }

    @Override
    public <R> R accept(SectionVisitor<R> visitor) {
        return visitor.visitLogs(this);
    }
}
