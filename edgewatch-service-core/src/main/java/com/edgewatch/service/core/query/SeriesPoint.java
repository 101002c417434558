package com.edgewatch.service.core.query;

/** One point of a queried series; for stepped queries the average of a bucket starting at {@code timestamp}. */
public record SeriesPoint(long timestamp, double value) {}
