package com.codewatch.core.events;

import java.util.Map;

/**
 * Write side handed to a capability: every event goes out under the sink's own
 * source and step, so a capability cannot publish as anyone else.
 */
public interface EventSink {

    String sourceId();

    String stepId();

    /**
     * Publishes an event. Never blocks on subscribers.
     *
     * @return the published event, with its sequence number assigned
     */
    ReviewEvent emit(String eventType, Map<String, Object> payload);
}
