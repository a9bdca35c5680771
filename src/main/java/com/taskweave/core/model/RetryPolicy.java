package com.taskweave.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Retry settings for a task.
 *
 * @param maxAttempts     total attempts including the first one (at least 1)
 * @param baseDelay       delay fed into the backoff function
 * @param backoff         how the delay grows between attempts
 * @param maxDelay        upper bound for any single delay, nullable
 * @param retryableErrors message substrings that make an error retryable; empty means every task error
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    BackoffKind backoff,
    Duration maxDelay,
    List<String> retryableErrors
) implements Serializable {

    private static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, BackoffKind.FIXED, null, List.of());

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        baseDelay = baseDelay != null ? baseDelay : Duration.ZERO;
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        backoff = backoff != null ? backoff : BackoffKind.FIXED;
        retryableErrors = retryableErrors != null ? List.copyOf(retryableErrors) : List.of();
    }

    /** A single attempt, no retries. */
    public static RetryPolicy none() {
        return NONE;
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, BackoffKind backoff) {
        return new RetryPolicy(maxAttempts, baseDelay, backoff, null, List.of());
    }

    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, backoff, maxDelay, retryableErrors);
    }

    public RetryPolicy withRetryableErrors(String... substrings) {
        return new RetryPolicy(maxAttempts, baseDelay, backoff, maxDelay, List.of(substrings));
    }

    /**
     * True when {@code message} contains one of the configured substrings, or when
     * no substrings are configured.
     */
    public boolean matches(String message) {
        if (retryableErrors.isEmpty()) {
            return true;
        }
        return message != null && retryableErrors.stream().anyMatch(message::contains);
    }

    /**
     * True only when substrings are configured and one of them occurs in {@code message}.
     */
    public boolean explicitlyLists(String message) {
        return !retryableErrors.isEmpty() && matches(message);
    }
}
