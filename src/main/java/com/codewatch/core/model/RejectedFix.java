package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A fix that consolidation refused to attach.
 */
public record RejectedFix(
    @JsonProperty("fix_id") String fixId,
    @JsonProperty("finding_id") String findingId,
    @JsonProperty("step_id") String stepId,
    String reason
) implements Serializable {}
