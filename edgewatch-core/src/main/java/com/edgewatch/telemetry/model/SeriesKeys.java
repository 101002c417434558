package com.edgewatch.telemetry.model;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Builds the canonical series key {@code name{a="1",b="2"}} with labels sorted by name. Label names are restricted
 * to {@code [a-zA-Z_][a-zA-Z0-9_]*} and values are escaped, so distinct label sets never share a key.
 */
public final class SeriesKeys {

    /** Label that carries the metric name in Prometheus-style label sets. */
    public static final String NAME_LABEL = "__name__";

    private static final Pattern METRIC_NAME = Pattern.compile("[a-zA-Z_:][a-zA-Z0-9_:]*");
    private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private SeriesKeys() {}

    public static boolean isValidMetricName(String name) {
        return name != null && METRIC_NAME.matcher(name).matches();
    }

    public static boolean isValidLabelName(String name) {
        return name != null && LABEL_NAME.matcher(name).matches();
    }

    public static String canonical(String metricName, Map<String, String> labels) {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metric name is required");
        }
        StringBuilder sb = new StringBuilder(metricName).append('{');
        boolean first = true;
        for (Map.Entry<String, String> e : new TreeMap<>(labels).entrySet()) {
            if (NAME_LABEL.equals(e.getKey())) {
                continue;
            }
            if (!isValidLabelName(e.getKey())) {
                throw new IllegalArgumentException("invalid label name: " + e.getKey());
            }
            if (!first) {
                sb.append(',');
            }
            sb.append(e.getKey()).append("=\"").append(escape(e.getValue())).append('"');
            first = false;
        }
        return sb.append('}').toString();
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
