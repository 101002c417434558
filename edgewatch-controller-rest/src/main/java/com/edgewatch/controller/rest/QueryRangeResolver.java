package com.edgewatch.controller.rest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/** Resolves {@code from}/{@code to} query parameters given as epoch millis or ISO-8601 instants. */
public final class QueryRangeResolver {

    static final Duration DEFAULT_RANGE = Duration.ofHours(1);

    private QueryRangeResolver() {}

    public record ResolvedRange(Instant from, Instant to) {}

    /** Missing {@code to} means now; missing {@code from} means one hour before {@code to}. */
    public static ResolvedRange resolve(String from, String to, Clock clock) {
        Instant end = isBlank(to) ? clock.instant() : parse(to, "to");
        Instant start = isBlank(from) ? end.minus(DEFAULT_RANGE) : parse(from, "from");
        return new ResolvedRange(start, end);
    }

    static Instant parse(String value, String name) {
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(trimmed));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid " + name + ": " + value, ex);
            }
        }
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, ex);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
