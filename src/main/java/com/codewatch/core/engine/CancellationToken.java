package com.codewatch.core.engine;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Review-level cancellation signal shared by the executor, the retry supervisor and
 * in-flight capability invocations.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Signals cancellation and runs the registered callbacks. Later calls do nothing.
     *
     * @return {@code true} if this call performed the cancellation
     */
    public boolean cancel() {
        synchronized (this) {
            if (cancelled.getCount() == 0) {
                return false;
            }
            cancelled.countDown();
        }
        for (Runnable callback : callbacks) {
            callback.run();
        }
        callbacks.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return {@code true} if the token was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Review cancelled");
        }
    }

    /**
     * Registers a callback run on cancellation, or immediately if already cancelled.
     *
     * @return a registration whose {@code close()} removes the callback
     */
    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!isCancelled()) {
                callbacks.add(callback);
                return () -> callbacks.remove(callback);
            }
        }
        callback.run();
        return () -> { };
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
