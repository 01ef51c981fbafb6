package com.codewatch.dispatch.api;

import com.codewatch.core.engine.ReviewHandle;
import com.codewatch.core.model.ReviewReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outbound view of a review's state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewResponse(
    @JsonProperty("review_id") String reviewId,
    String status,
    String filename,
    @JsonProperty("submitted_at") Instant submittedAt,
    boolean cancelled,
    String error,
    ReviewReport report
) {

    static ReviewResponse of(ReviewHandle handle) {
        ReviewReport report = handle.report().orElse(null);
        return new ReviewResponse(handle.reviewId(), handle.status().wireName(), handle.input().filename(),
                handle.submittedAt(), handle.cancellation().isCancelled(), handle.error(), report);
    }

    /** Same view without the report body, for listings. */
    static ReviewResponse summary(ReviewHandle handle) {
        return new ReviewResponse(handle.reviewId(), handle.status().wireName(), handle.input().filename(),
                handle.submittedAt(), handle.cancellation().isCancelled(), handle.error(), null);
    }
}
