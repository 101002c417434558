package com.edgewatch.service.core.store;

import java.util.List;

/**
 * Result of one batched put.
 *
 * @param unprocessed items the store did not persist; empty on full success
 * @param errorKind why {@code unprocessed} items were not written; {@code null} on full success
 */
public record PutOutcome(List<StoredItem> unprocessed, StorageErrorKind errorKind, String detail) {

    public PutOutcome {
        unprocessed = unprocessed == null ? List.of() : List.copyOf(unprocessed);
    }

    public static PutOutcome complete() {
        return new PutOutcome(List.of(), null, null);
    }

    public static PutOutcome partial(List<StoredItem> unprocessed, StorageErrorKind errorKind, String detail) {
        return new PutOutcome(unprocessed, errorKind, detail);
    }

    public boolean isComplete() {
        return unprocessed.isEmpty();
    }
}
