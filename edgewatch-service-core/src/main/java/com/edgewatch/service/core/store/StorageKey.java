package com.edgewatch.service.core.store;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Primary key of a stored item: the cluster id partitions, the sort key orders and disambiguates.
 *
 * <p>The sort key is {@code <13-digit timestamp>#<32 hex chars>}, always {@value #SORT_KEY_LENGTH} bytes. Only
 * timestamps up to {@value #MAX_TIMESTAMP} fit the 13 digits.
 */
public record StorageKey(String partition, String sort) {

    public static final int SORT_KEY_LENGTH = 46;

    /** Largest millisecond timestamp a sort key can hold (year 2286). */
    public static final long MAX_TIMESTAMP = 9_999_999_999_999L;

    public StorageKey {
        Objects.requireNonNull(partition, "partition");
        Objects.requireNonNull(sort, "sort");
    }

    public int byteLength() {
        return partition.getBytes(StandardCharsets.UTF_8).length + sort.getBytes(StandardCharsets.UTF_8).length;
    }
}
