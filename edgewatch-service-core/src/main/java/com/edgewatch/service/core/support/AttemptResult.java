package com.edgewatch.service.core.support;

/** Result of one attempt inside {@link BoundedRetry}. */
public record AttemptResult<T>(Status status, T value, String detail) {

    public enum Status {
        SUCCEEDED,
        RETRYABLE,
        PERMANENT
    }

    public static <T> AttemptResult<T> success(T value) {
        return new AttemptResult<>(Status.SUCCEEDED, value, null);
    }

    public static <T> AttemptResult<T> retryable(T value, String detail) {
        return new AttemptResult<>(Status.RETRYABLE, value, detail);
    }

    public static <T> AttemptResult<T> permanent(T value, String detail) {
        return new AttemptResult<>(Status.PERMANENT, value, detail);
    }
}
