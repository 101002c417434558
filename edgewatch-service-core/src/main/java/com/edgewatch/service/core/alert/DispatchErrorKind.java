package com.edgewatch.service.core.alert;

public enum DispatchErrorKind {
    /** Network failure, rate limiting or a server-side error; worth retrying. */
    CHANNEL_UNAVAILABLE,
    /** The channel rejected the target or the message; retrying will not help. */
    INVALID_TARGET;

    public boolean retryable() {
        return this == CHANNEL_UNAVAILABLE;
    }
}
