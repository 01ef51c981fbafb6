package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate numbers over one review.
 */
public record ReportMetrics(
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("total_findings") int totalFindings,
    @JsonProperty("by_severity") Map<String, Integer> bySeverity,
    @JsonProperty("by_category") Map<String, Integer> byCategory,
    @JsonProperty("duplicates_removed") int duplicatesRemoved,
    @JsonProperty("fixes_verified") int fixesVerified,
    @JsonProperty("steps_completed") int stepsCompleted,
    @JsonProperty("steps_failed") int stepsFailed,
    @JsonProperty("total_attempts") int totalAttempts
) implements Serializable {

    public ReportMetrics {
        bySeverity = bySeverity == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bySeverity));
        byCategory = byCategory == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byCategory));
    }
}
