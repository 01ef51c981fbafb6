package com.codewatch.core.engine;

import com.codewatch.core.config.CodewatchProperties;
import com.codewatch.core.events.EventBus;
import com.codewatch.core.events.EventTypes;
import com.codewatch.core.events.ReviewEvent;
import com.codewatch.core.metrics.CodewatchMetrics;
import com.codewatch.core.model.Plan;
import com.codewatch.core.model.ReviewInput;
import com.codewatch.core.model.ReviewReport;
import com.codewatch.core.model.ReviewStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Entry point for submitting, observing and cancelling reviews. Each review gets its
 * own event bus, closed once the coordinator returns.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewCoordinator coordinator;
    private final CodewatchProperties properties;
    private final CodewatchMetrics metrics;
    private final ExecutorService reviewExecutor;
    private final ExecutorService deliveryExecutor;
    private final Map<String, ReviewHandle> reviews = new ConcurrentHashMap<>();

    public ReviewService(ReviewCoordinator coordinator, CodewatchProperties properties, CodewatchMetrics metrics) {
        this.coordinator = coordinator;
        this.properties = properties;
        this.metrics = metrics;
        this.reviewExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "codewatch-review");
            t.setDaemon(true);
            return t;
        });
        this.deliveryExecutor = EventBus.newDeliveryExecutor();
    }

    @PreDestroy
    public void shutdown() {
        reviews.values().forEach(handle -> handle.cancellation().cancel());
        reviewExecutor.shutdownNow();
        deliveryExecutor.shutdownNow();
    }

    public String submit(ReviewInput input) {
        return submit(input, null);
    }

    /**
     * Starts a review in the background.
     *
     * @param plan explicit plan, or {@code null} for the default plan
     * @return the review id
     * @throws IllegalArgumentException if the input has no code or exceeds the size limit
     * @throws com.codewatch.core.scheduler.PlanException if an explicit plan is not executable
     */
    public String submit(ReviewInput input, Plan plan) {
        return start(input, plan).reviewId();
    }

    private ReviewHandle start(ReviewInput input, Plan plan) {
        validate(input);
        evictFinished(Instant.now());
        if (plan != null) {
            coordinator.validate(plan);
        }
        String reviewId = newReviewId();
        var bus = new EventBus(reviewId, properties.getHistorySize(),
                properties.getSubscriberQueueCapacity(), deliveryExecutor, metrics);
        var handle = new ReviewHandle(reviewId, input, bus);
        reviews.put(reviewId, handle);
        handle.markRunning();
        log.info("Submitted review {} for {}", reviewId, input.filename());

        CompletableFuture
                .supplyAsync(() -> coordinator.review(reviewId, input, plan, bus, handle.cancellation()), reviewExecutor)
                .whenComplete((report, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        log.error("Review {} failed: {}", reviewId, cause.getMessage());
                        handle.fail(cause);
                    } else {
                        handle.complete(report);
                    }
                    bus.close();
                });
        return handle;
    }

    /**
     * Runs a review and waits for its report, streaming every event to the listener.
     * The listener has received the whole stream when this returns.
     */
    public ReviewReport run(ReviewInput input, Plan plan, Consumer<ReviewEvent> listener) {
        ReviewHandle handle = start(input, plan);
        String reviewId = handle.reviewId();
        EventBus.Subscription subscription = handle.bus().subscribe(listener, true, null);
        try {
            ReviewReport report = handle.completion().join();
            subscription.awaitTermination(Duration.ofSeconds(30));
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(reviewId);
            throw new CompletionException(e);
        }
    }

    public EventBus.Subscription subscribe(String reviewId, Consumer<ReviewEvent> consumer,
                                           boolean replay, Runnable onClose) {
        return require(reviewId).bus().subscribe(consumer, replay, onClose);
    }

    public Collection<ReviewHandle> all() {
        return List.copyOf(reviews.values());
    }

    public Optional<ReviewHandle> find(String reviewId) {
        return Optional.ofNullable(reviews.get(reviewId));
    }

    public Optional<ReviewReport> report(String reviewId) {
        return find(reviewId).flatMap(ReviewHandle::report);
    }

    /**
     * @throws ReviewNotFoundException if the review is unknown
     */
    public ReviewStatus status(String reviewId) {
        return require(reviewId).status();
    }

    /**
     * Requests cancellation. Running steps stop at their next check, pending steps are
     * never dispatched, and the report is still produced.
     *
     * @return {@code true} if this call cancelled a running review
     */
    public boolean cancel(String reviewId) {
        ReviewHandle handle = require(reviewId);
        synchronized (handle) {
            if (handle.status().isTerminal() || handle.cancellation().isCancelled()) {
                return false;
            }
            log.info("Cancelling review {}", reviewId);
            // Announced first so it precedes the events of the winding-down review
            handle.bus().emitter(ReviewCoordinator.SYSTEM_SOURCE)
                    .emit(EventTypes.REVIEW_CANCELLED, Map.of("review_id", reviewId));
            handle.cancellation().cancel();
        }
        return true;
    }

    /**
     * Forgets finished reviews older than the retention window, then the oldest finished
     * ones beyond the retention cap. Running reviews are never evicted.
     *
     * @return number of reviews removed
     */
    int evictFinished(Instant now) {
        Instant cutoff = now.minus(properties.getReviewRetention());
        int removed = 0;
        List<ReviewHandle> finished = new ArrayList<>();
        for (ReviewHandle handle : reviews.values()) {
            Optional<Instant> finishedAt = handle.finishedAt();
            if (finishedAt.isEmpty()) {
                continue;
            }
            if (finishedAt.get().isBefore(cutoff)) {
                if (reviews.remove(handle.reviewId(), handle)) {
                    removed++;
                }
            } else {
                finished.add(handle);
            }
        }
        int excess = finished.size() - Math.max(0, properties.getMaxRetainedReviews());
        if (excess > 0) {
            finished.sort(Comparator.comparing(h -> h.finishedAt().orElse(now)));
            for (ReviewHandle handle : finished.subList(0, excess)) {
                if (reviews.remove(handle.reviewId(), handle)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} finished review(s), {} tracked", removed, reviews.size());
        }
        return removed;
    }

    private ReviewHandle require(String reviewId) {
        ReviewHandle handle = reviews.get(reviewId);
        if (handle == null) {
            throw new ReviewNotFoundException(reviewId);
        }
        return handle;
    }

    private void validate(ReviewInput input) {
        if (input == null || input.code() == null || input.code().isBlank()) {
            throw new IllegalArgumentException("code is required");
        }
        int bytes = input.code().getBytes(StandardCharsets.UTF_8).length;
        if (bytes > properties.getMaxCodeBytes()) {
            throw new IllegalArgumentException("code is " + bytes + " bytes, limit is "
                    + properties.getMaxCodeBytes());
        }
    }

    static String newReviewId() {
        return "REV-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
