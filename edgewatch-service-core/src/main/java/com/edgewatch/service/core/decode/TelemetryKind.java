package com.edgewatch.service.core.decode;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Wire discriminator of an envelope section. */
public enum TelemetryKind {
    METRICS("metrics"),
    LOGS("logs"),
    TRACES("traces");

    private final String wireName;

    TelemetryKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TelemetryKind> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.wireName.equals(normalized)).findFirst();
    }
}
