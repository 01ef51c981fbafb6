package com.codewatch.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * The single publishing handle for one source on one {@link EventBus}.
 * <p>
 * Allocates the per-source sequence and publishes under the same monitor, so
 * concurrent emits from one source reach every subscriber in sequence order.
 */
public final class EventEmitter {

    private final EventBus bus;
    private final String sourceId;
    private long sequence;

    EventEmitter(EventBus bus, String sourceId) {
        this.bus = bus;
        this.sourceId = sourceId;
    }

    public String sourceId() {
        return sourceId;
    }

    public ReviewEvent emit(String eventType, Map<String, Object> payload) {
        return emit(eventType, null, payload);
    }

    public synchronized ReviewEvent emit(String eventType, String stepId, Map<String, Object> payload) {
        var event = new ReviewEvent(eventType, sourceId, ++sequence, Instant.now(),
                payload, bus.reviewId(), stepId);
        bus.publish(event);
        return event;
    }

    /** Returns a sink that stamps every event with the given step id. */
    public EventSink forStep(String stepId) {
        return new StepSink(stepId);
    }

    synchronized long lastSequence() {
        return sequence;
    }

    private final class StepSink implements EventSink {
        private final String stepId;

        private StepSink(String stepId) {
            this.stepId = stepId;
        }

        @Override
        public String sourceId() {
            return sourceId;
        }

        @Override
        public String stepId() {
            return stepId;
        }

        @Override
        public ReviewEvent emit(String eventType, Map<String, Object> payload) {
            return EventEmitter.this.emit(eventType, stepId, payload);
        }
    }
}
