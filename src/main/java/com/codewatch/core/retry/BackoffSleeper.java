package com.codewatch.core.retry;

import com.codewatch.core.engine.CancellationToken;

import java.time.Duration;

/**
 * Waits out a backoff delay. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface BackoffSleeper {

    /** Waits on the cancellation token, so a cancelled review stops sleeping at once. */
    BackoffSleeper CANCELLABLE = (delay, cancellation) -> cancellation.await(delay);

    /**
     * @return {@code true} if the review was cancelled during the wait
     */
    boolean sleep(Duration delay, CancellationToken cancellation) throws InterruptedException;
}
