package com.edgewatch.service.core.store;

public enum StorageErrorKind {
    /** The store pushed back (lock contention, rate limit, timeout); worth retrying. */
    THROTTLED,
    /** The item exceeds the per-item size ceiling or its key cannot be encoded; never retried. */
    ITEM_TOO_LARGE,
    /** The store could not be reached or failed the request. */
    UNAVAILABLE;

    public boolean retryable() {
        return this != ITEM_TOO_LARGE;
    }
}
