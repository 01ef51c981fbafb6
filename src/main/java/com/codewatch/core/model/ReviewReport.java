package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Final report of a review. Written only by the coordinator, once the whole plan has resolved.
 */
public record ReviewReport(
    @JsonProperty("review_id") String reviewId,
    @JsonProperty("plan_id") String planId,
    ReviewStatus status,
    String summary,
    List<Finding> findings,
    List<Fix> fixes,
    @JsonProperty("rejected_fixes") List<RejectedFix> rejectedFixes,
    @JsonProperty("step_results") List<StepResult> stepResults,
    List<String> errors,
    boolean cancelled,
    ReportMetrics metrics
) implements Serializable {

    public ReviewReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
        rejectedFixes = rejectedFixes == null ? List.of() : List.copyOf(rejectedFixes);
        stepResults = stepResults == null ? List.of() : List.copyOf(stepResults);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
