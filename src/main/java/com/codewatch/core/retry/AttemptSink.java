package com.codewatch.core.retry;

import com.codewatch.core.events.EventSink;
import com.codewatch.core.events.ReviewEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Sink handed to one invocation attempt. Once the supervisor closes it, for example after
 * a timeout, anything the abandoned invocation still emits is dropped.
 */
final class AttemptSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(AttemptSink.class);

    private final EventSink delegate;
    private final int attempt;
    private boolean open = true;

    AttemptSink(EventSink delegate, int attempt) {
        this.delegate = delegate;
        this.attempt = attempt;
    }

    @Override
    public String sourceId() {
        return delegate.sourceId();
    }

    @Override
    public String stepId() {
        return delegate.stepId();
    }

    /**
     * @return the published event, or {@code null} if the attempt was already abandoned
     */
    @Override
    public synchronized ReviewEvent emit(String eventType, Map<String, Object> payload) {
        if (!open) {
            log.debug("Dropping {} from abandoned attempt {} of step {}", eventType, attempt, delegate.stepId());
            return null;
        }
        return delegate.emit(eventType, payload);
    }

    synchronized void close() {
        open = false;
    }
}
