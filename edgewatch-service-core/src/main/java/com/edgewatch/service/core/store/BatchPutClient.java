package com.edgewatch.service.core.store;

import java.util.List;

/** Batched upsert into the underlying store. Implementations report failures per item instead of throwing. */
public interface BatchPutClient {

    /**
     * Upserts all items of one table in a single request. Items are keyed by their {@link StorageKey}; writing an
     * existing key replaces the item.
     */
    PutOutcome putChunk(RecordTable table, List<StoredItem> items);
}
