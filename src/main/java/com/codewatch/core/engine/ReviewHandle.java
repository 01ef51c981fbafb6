package com.codewatch.core.engine;

import com.codewatch.core.events.EventBus;
import com.codewatch.core.model.ReviewInput;
import com.codewatch.core.model.ReviewReport;
import com.codewatch.core.model.ReviewStatus;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A submitted review: its stream, its cancellation signal and, once done, its report.
 */
public final class ReviewHandle {

    private final String reviewId;
    private final ReviewInput input;
    private final EventBus bus;
    private final CancellationToken cancellation = new CancellationToken();
    private final CompletableFuture<ReviewReport> completion = new CompletableFuture<>();
    private final Instant submittedAt = Instant.now();
    private volatile ReviewStatus status = ReviewStatus.PENDING;
    private volatile String error;
    private volatile Instant finishedAt;

    ReviewHandle(String reviewId, ReviewInput input, EventBus bus) {
        this.reviewId = reviewId;
        this.input = input;
        this.bus = bus;
    }

    public String reviewId() {
        return reviewId;
    }

    public ReviewInput input() {
        return input;
    }

    public EventBus bus() {
        return bus;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public ReviewStatus status() {
        return status;
    }

    /** When the review reached a terminal state; empty while it runs. */
    public Optional<Instant> finishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    /** Why the review ended without a report (nullable). */
    public String error() {
        return error;
    }

    public Optional<ReviewReport> report() {
        return Optional.ofNullable(completion.getNow(null));
    }

    /** Completes with the report, or exceptionally if the review could not run. */
    public CompletableFuture<ReviewReport> completion() {
        return completion;
    }

    void markRunning() {
        status = ReviewStatus.RUNNING;
    }

    void complete(ReviewReport report) {
        finishedAt = Instant.now();
        status = report.status();
        completion.complete(report);
    }

    void fail(Throwable cause) {
        finishedAt = Instant.now();
        error = cause.getMessage();
        status = ReviewStatus.FAILED;
        completion.completeExceptionally(cause);
    }
}
