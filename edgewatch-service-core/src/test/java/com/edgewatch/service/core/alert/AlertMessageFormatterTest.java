package com.edgewatch.service.core.alert;

import static org.assertj.core.api.Assertions.assertThat;

import com.edgewatch.telemetry.model.AnomalyEvent;
import com.edgewatch.telemetry.model.MetricKind;
import com.edgewatch.telemetry.model.Severity;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlertMessageFormatterTest {

    private final AlertMessageFormatter formatter = new AlertMessageFormatter();

    @Test
    void rendersHeaderAndOneLinePerEvent() {
        String text = formatter.format(
                "edge-01",
                List.of(
                        event("cpu{core=\"0\"}", 97.5, 3.25, Severity.CRITICAL),
                        event("mem{}", 12.0, Double.POSITIVE_INFINITY, Severity.CRITICAL)));

        assertThat(text).startsWith("🚨 Anomaly Alert for Cluster `edge-01` 🚨\n\n");
        assertThat(text).contains("• *CRITICAL* `cpu{core=\"0\"}` value=97.5 median=10 score=3.25 at 2023-11-14T22:13:20Z");
        assertThat(text).contains("score=∞");
        assertThat(text.lines().filter(l -> l.startsWith("•")).count()).isEqualTo(2);
    }

    @Test
    void backticksInSeriesKeysAreNeutralised() {
        String text = formatter.format("c1", List.of(event("m{path=\"`rm`\"}", 1, 4, Severity.WARNING)));

        assertThat(text).contains("`m{path=\"'rm'\"}`");
    }

    @Test
    void longMessagesAreTruncated() {
        List<AnomalyEvent> events = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            events.add(event("series_with_a_rather_long_name_" + i + "{pod=\"api-" + i + "\"}", i, 5, Severity.WARNING));
        }

        String text = formatter.format("c1", events);

        assertThat(text.length()).isLessThanOrEqualTo(AlertMessageFormatter.MAX_MESSAGE_CHARS);
        assertThat(text).containsPattern("… and \\d+ more$");
    }

    private static AnomalyEvent event(String seriesKey, double value, double score, Severity severity) {
        return new AnomalyEvent(
                "c1", seriesKey, "m", MetricKind.GAUGE, 1_700_000_000_000L, value, 10.0, 1.0, score, severity);
    }
}
