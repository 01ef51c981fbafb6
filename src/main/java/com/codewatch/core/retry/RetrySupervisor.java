package com.codewatch.core.retry;

import com.codewatch.core.capability.Capability;
import com.codewatch.core.capability.CapabilityContext;
import com.codewatch.core.capability.CapabilityException;
import com.codewatch.core.engine.CancellationToken;
import com.codewatch.core.events.EventSink;
import com.codewatch.core.events.EventTypes;
import com.codewatch.core.metrics.CodewatchMetrics;
import com.codewatch.core.model.CapabilityResult;
import com.codewatch.core.model.ReviewInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps each capability invocation with a timeout, error classification, result
 * validation and bounded exponential backoff.
 * <p>
 * Recoverable errors are retried until the policy's attempts run out; anything else
 * fails the step at once. Before each backoff wait an {@code agent_retry} event is
 * published through the capability's own sink.
 */
public class RetrySupervisor {

    private static final Logger log = LoggerFactory.getLogger(RetrySupervisor.class);

    private final RetryPolicy policy;
    private final Duration timeout;
    private final ExecutorService invocationExecutor;
    private final BackoffSleeper sleeper;
    private final CodewatchMetrics metrics;

    public RetrySupervisor(RetryPolicy policy, Duration timeout, ExecutorService invocationExecutor,
                           BackoffSleeper sleeper, CodewatchMetrics metrics) {
        this.policy = policy;
        this.timeout = timeout;
        this.invocationExecutor = invocationExecutor;
        this.sleeper = sleeper != null ? sleeper : BackoffSleeper.CANCELLABLE;
        this.metrics = metrics;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public RetryOutcome invoke(Capability capability, ReviewInput input,
                               CapabilityContext context, EventSink sink) {
        return invoke(capability, input, context, sink, policy);
    }

    /**
     * Invokes the capability under the given policy.
     * Never throws for capability failures; they come back as a failed outcome.
     */
    public RetryOutcome invoke(Capability capability, ReviewInput input, CapabilityContext context,
                               EventSink sink, RetryPolicy policy) {
        long start = System.currentTimeMillis();
        CancellationToken cancellation = context.cancellation();
        CapabilityException lastError = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (cancellation.isCancelled()) {
                return RetryOutcome.cancelled(lastError, attempt - 1, elapsed(start));
            }
            try {
                CapabilityResult result = invokeOnce(capability, input, context.withAttempt(attempt), sink);
                ResultValidator.validate(result, context, sink.sourceId());
                if (attempt > 1) {
                    log.info("Capability {} succeeded on attempt {}/{}",
                            capability.id(), attempt, policy.maxAttempts());
                }
                return RetryOutcome.success(result, attempt, elapsed(start));
            } catch (CapabilityException e) {
                lastError = e;
                if (cancellation.isCancelled()) {
                    return RetryOutcome.cancelled(e, attempt, elapsed(start));
                }
                if (!e.isRecoverable()) {
                    log.warn("Capability {} failed with non-recoverable {} on attempt {}: {}",
                            capability.id(), e.kind().wireName(), attempt, e.getMessage());
                    return RetryOutcome.failure(e, attempt, elapsed(start));
                }
                if (attempt == policy.maxAttempts()) {
                    log.warn("Capability {} exhausted {} attempts, last error {}: {}",
                            capability.id(), attempt, e.kind().wireName(), e.getMessage());
                    break;
                }
                Duration delay = policy.delayBeforeAttempt(attempt + 1);
                announceRetry(capability, sink, attempt, policy, delay, e);
                try {
                    if (sleeper.sleep(delay, cancellation)) {
                        return RetryOutcome.cancelled(e, attempt, elapsed(start));
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return RetryOutcome.cancelled(e, attempt, elapsed(start));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RetryOutcome.cancelled(lastError, attempt, elapsed(start));
            }
        }
        return RetryOutcome.failure(lastError, policy.maxAttempts(), elapsed(start));
    }

    private CapabilityResult invokeOnce(Capability capability, ReviewInput input,
                                        CapabilityContext context, EventSink sink)
            throws InterruptedException {
        var attemptSink = new AttemptSink(sink, context.attempt());
        Future<CapabilityResult> future;
        try {
            future = invocationExecutor.submit(() -> capability.analyze(input, context, attemptSink));
        } catch (RejectedExecutionException e) {
            throw CapabilityException.classify(e);
        }
        try (CancellationToken.Registration ignored =
                     context.cancellation().onCancel(() -> future.cancel(true))) {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw CapabilityException.timeout("Capability " + capability.id()
                    + " timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            throw CapabilityException.classify(e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException e) {
            throw CapabilityException.classify(e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } finally {
            attemptSink.close();
        }
    }

    private void announceRetry(Capability capability, EventSink sink, int attempt,
                               RetryPolicy policy, Duration delay, CapabilityException cause) {
        log.warn("Capability {} attempt {}/{} failed ({}), retrying in {}ms: {}",
                capability.id(), attempt, policy.maxAttempts(), cause.kind().wireName(),
                delay.toMillis(), cause.getMessage());
        var payload = new LinkedHashMap<String, Object>();
        payload.put("attempt", attempt);
        payload.put("next_attempt", attempt + 1);
        payload.put("max_attempts", policy.maxAttempts());
        payload.put("delay_ms", delay.toMillis());
        payload.put("error_kind", cause.kind().wireName());
        payload.put("cause", cause.getMessage());
        sink.emit(EventTypes.AGENT_RETRY, payload);
        if (metrics != null) {
            metrics.recordRetry(capability.id(), cause.kind().wireName());
        }
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
