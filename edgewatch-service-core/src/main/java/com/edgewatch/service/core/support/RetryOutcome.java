package com.edgewatch.service.core.support;

/**
 * Final result of a bounded retry loop.
 *
 * @param value the value returned by the last attempt
 * @param attempts number of attempts made
 * @param status {@code SUCCEEDED}, {@code PERMANENT} when an attempt gave up early, or {@code RETRYABLE} when
 *     attempts ran out
 */
public record RetryOutcome<T>(T value, int attempts, AttemptResult.Status status, String detail) {

    public boolean succeeded() {
        return status == AttemptResult.Status.SUCCEEDED;
    }

    public boolean exhausted() {
        return status == AttemptResult.Status.RETRYABLE;
    }
}
