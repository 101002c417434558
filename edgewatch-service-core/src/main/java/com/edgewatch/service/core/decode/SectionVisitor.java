package com.edgewatch.service.core.decode;

public interface SectionVisitor<R> {
    R visitMetrics(MetricSection section);

    R visitLogs(LogSection section);

    R visitTraces(TraceSection section);
}
