package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Per-step outcome recorded in the final report.
 *
 * @param stepId         the step
 * @param capabilityId   capability that ran it
 * @param status         {@link StepStatus#COMPLETED} or {@link StepStatus#FAILED}
 * @param attempts       invocations made (0 if never dispatched)
 * @param durationMs     wall time including backoff
 * @param error          failure message (nullable)
 * @param upstreamFailed whether a dependency had failed when the step ran
 */
public record StepResult(
    @JsonProperty("step_id") String stepId,
    @JsonProperty("capability_id") String capabilityId,
    StepStatus status,
    int attempts,
    @JsonProperty("duration_ms") long durationMs,
    String error,
    @JsonProperty("upstream_failed") boolean upstreamFailed
) implements Serializable {}
