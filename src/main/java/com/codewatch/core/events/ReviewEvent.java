package com.codewatch.core.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted during review execution, used for SSE streaming and CLI output.
 *
 * @param eventType event type from {@link EventTypes} (e.g. "plan_step_started")
 * @param sourceId  identity of the emitter (coordinator, system, or an agent)
 * @param sequence  per-source sequence number, strictly increasing from 1
 * @param timestamp when the event occurred
 * @param payload   arbitrary key-value data associated with the event
 * @param reviewId  the review this event belongs to
 * @param stepId    the plan step this event relates to (nullable for review-level events)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewEvent(
    @JsonProperty("event_type") String eventType,
    @JsonProperty("source_id") String sourceId,
    long sequence,
    Instant timestamp,
    Map<String, Object> payload,
    @JsonProperty("review_id") String reviewId,
    @JsonProperty("step_id") String stepId
) implements Serializable {

    public ReviewEvent {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /** Reads a payload value, or {@code null} when absent. */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) payload.get(key);
    }
}
