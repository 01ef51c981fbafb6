package com.codewatch.core.retry;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 * <p>
 * The delay before attempt {@code n} (n &ge; 2) is {@code min(maxDelay, baseDelay * 2^(n-2))}.
 *
 * @param maxAttempts total invocations allowed, including the first
 * @param baseDelay   delay before the second attempt
 * @param maxDelay    ceiling for any single delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public static final RetryPolicy DEFAULT =
            new RetryPolicy(3, Duration.ofMillis(400), Duration.ofMillis(3000));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay to wait before the given attempt.
     *
     * @param attempt 1-based attempt number; the first attempt has no delay
     */
    public Duration delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        int exponent = attempt - 2;
        if (exponent >= 30) {
            return maxDelay;
        }
        long millis = baseDelay.toMillis() * (1L << exponent);
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(millis);
    }
}
