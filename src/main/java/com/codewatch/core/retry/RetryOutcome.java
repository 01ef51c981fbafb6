package com.codewatch.core.retry;

import com.codewatch.core.capability.CapabilityException;
import com.codewatch.core.model.CapabilityResult;

/**
 * Result of a supervised invocation: a valid result, or the last error after
 * retries ran out, a non-recoverable error, or cancellation.
 *
 * @param result     the validated result (null unless succeeded)
 * @param error      the final error (null when succeeded)
 * @param attempts   invocations made
 * @param cancelled  whether the review was cancelled before a result arrived
 * @param durationMs wall time including backoff
 */
public record RetryOutcome(
    CapabilityResult result,
    CapabilityException error,
    int attempts,
    boolean cancelled,
    long durationMs
) {

    public static RetryOutcome success(CapabilityResult result, int attempts, long durationMs) {
        return new RetryOutcome(result, null, attempts, false, durationMs);
    }

    public static RetryOutcome failure(CapabilityException error, int attempts, long durationMs) {
        return new RetryOutcome(null, error, attempts, false, durationMs);
    }

    public static RetryOutcome cancelled(CapabilityException lastError, int attempts, long durationMs) {
        return new RetryOutcome(null, lastError, attempts, true, durationMs);
    }

    public boolean succeeded() {
        return result != null;
    }

    public String errorMessage() {
        if (cancelled) {
            return "cancelled";
        }
        return error == null ? null : error.kind().wireName() + ": " + error.getMessage();
    }
}
