package com.edgewatch.service.core.support;

import java.time.Duration;
import java.util.Locale;

/** Utility to parse simplified duration strings like "5m" as well as ISO-8601 "PT5M". */
public final class DurationParser {

    private DurationParser() {}

    public static Duration parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Duration cannot be null or empty");
        }

        String trimmed = input.trim();
        if (trimmed.regionMatches(true, 0, "P", 0, 1)) {
            try {
                return Duration.parse(trimmed);
            } catch (RuntimeException ex) {
                throw new IllegalArgumentException("Invalid duration: " + input, ex);
            }
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        try {
            if (lower.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(lower.substring(0, lower.length() - 2)));
            }
            long value = Long.parseLong(lower.substring(0, lower.length() - 1));
            switch (lower.charAt(lower.length() - 1)) {
                case 's':
                    return Duration.ofSeconds(value);
                case 'm':
                    return Duration.ofMinutes(value);
                case 'h':
                    return Duration.ofHours(value);
                case 'd':
                    return Duration.ofDays(value);
                default:
                    break;
            }
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + input, ex);
        }
        throw new IllegalArgumentException("Unsupported duration unit: " + input);
    }
}
