package com.edgewatch.service.core.support;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs an operation at most {@code maxAttempts} times with capped exponential backoff and jitter.
 *
 * <p>Attempts report their result as an {@link AttemptResult}; nothing is thrown across attempts. The attempt
 * function receives the 1-based attempt number.
 */
@Slf4j
public final class BoundedRetry {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private static final Sleeper THREAD_SLEEPER = d -> Thread.sleep(d.toMillis());

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public BoundedRetry(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this(maxAttempts, initialBackoff, maxBackoff, THREAD_SLEEPER);
    }

    public BoundedRetry(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> RetryOutcome<T> run(String operation, IntFunction<AttemptResult<T>> attempt) {
        AttemptResult<T> last = null;
        for (int attemptNo = 1; attemptNo <= maxAttempts; attemptNo++) {
            last = attempt.apply(attemptNo);
            if (last.status() != AttemptResult.Status.RETRYABLE) {
                return new RetryOutcome<>(last.value(), attemptNo, last.status(), last.detail());
            }
            if (attemptNo == maxAttempts) {
                break;
            }
            Duration backoff = backoffFor(attemptNo);
            log.warn(
                    "{} failed ({}). Retrying attempt {}/{} after {} ms",
                    operation,
                    last.detail(),
                    attemptNo + 1,
                    maxAttempts,
                    backoff.toMillis());
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return new RetryOutcome<>(last.value(), attemptNo, AttemptResult.Status.RETRYABLE, "interrupted");
            }
        }
        return new RetryOutcome<>(last.value(), maxAttempts, AttemptResult.Status.RETRYABLE, last.detail());
    }

    Duration backoffFor(int attemptNo) {
        long base = Math.max(1L, initialBackoff.toMillis()) << Math.min(attemptNo - 1, 6);
        long jitter = ThreadLocalRandom.current().nextLong(base, base * 2);
        return Duration.ofMillis(Math.min(jitter, maxBackoff.toMillis()));
    }
}
