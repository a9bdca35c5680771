package com.taskweave.core.engine;

import com.taskweave.core.model.BackoffKind;
import com.taskweave.core.model.RetryPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Delay between retry attempts.
 * <p>
 * FIXED: base. LINEAR: base x attempt. EXPONENTIAL: base x 2^(attempt-1).
 * JITTER: the exponential delay scaled by a uniform factor in [0.5, 1.0].
 * Every kind is clamped to the policy's maxDelay when one is set.
 */
public final class Backoff {

    private final DoubleSupplier random;

    public Backoff() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1) for JITTER
     */
    public Backoff(DoubleSupplier random) {
        this.random = random;
    }

    /**
     * Delay to wait after the failed attempt number {@code attempt} (1-based).
     */
    public Duration delay(RetryPolicy policy, int attempt) {
        return delay(policy.baseDelay(), attempt, policy.backoff(), policy.maxDelay());
    }

    public Duration delay(Duration baseDelay, int attempt, BackoffKind kind, Duration maxDelay) {
        long base = baseDelay.toMillis();
        long millis = switch (kind) {
            case FIXED -> base;
            case LINEAR -> saturatedMultiply(base, attempt);
            case EXPONENTIAL -> exponential(base, attempt);
            case JITTER -> Math.round(exponential(base, attempt) * (0.5 + 0.5 * random.getAsDouble()));
        };
        if (maxDelay != null) {
            millis = Math.min(millis, maxDelay.toMillis());
        }
        return Duration.ofMillis(Math.max(0, millis));
    }

    private static long exponential(long base, int attempt) {
        int shift = Math.max(0, attempt - 1);
        if (shift >= Long.SIZE - 1) {
            return base == 0 ? 0 : Long.MAX_VALUE;
        }
        return saturatedMultiply(base, 1L << shift);
    }

    private static long saturatedMultiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
