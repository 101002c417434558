package com.edgewatch.service.core.alert;

import com.edgewatch.telemetry.model.AnomalyEvent;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Component;

/** Renders the anomalies of one cluster as a single Markdown message. */
@Component
public class AlertMessageFormatter {

    /** Telegram rejects longer texts. */
    static final int MAX_MESSAGE_CHARS = 4096;

    public String format(String clusterId, List<AnomalyEvent> events) {
        StringBuilder sb = new StringBuilder();
        sb.append("🚨 Anomaly Alert for Cluster `")
                .append(inline(clusterId))
                .append("` 🚨\n\n");
        for (int i = 0; i < events.size(); i++) {
            String line = line(events.get(i));
            String more = "… and " + (events.size() - i) + " more";
            if (sb.length() + line.length() + 1 > MAX_MESSAGE_CHARS - more.length()) {
                sb.append(more);
                return sb.toString();
            }
            sb.append(line).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static String line(AnomalyEvent e) {
        return "• *" + e.severity() + "* `" + inline(e.seriesKey()) + "`"
                + " value=" + number(e.observedValue())
                + " median=" + number(e.baselineMedian())
                + " score=" + (Double.isInfinite(e.score()) ? "∞" : number(e.score()))
                + " at " + Instant.ofEpochMilli(e.timestamp());
    }

    /** Backticks would close the inline code span. */
    private static String inline(String text) {
        return text.replace('`', '\'');
    }

    private static String number(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }
}
