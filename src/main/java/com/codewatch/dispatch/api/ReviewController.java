package com.codewatch.dispatch.api;

import com.codewatch.core.engine.ReviewHandle;
import com.codewatch.core.engine.ReviewService;
import com.codewatch.core.model.ReviewInput;
import com.codewatch.core.model.ReviewStatus;
import com.codewatch.core.scheduler.PlanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for review lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/reviews")
public class ReviewController {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private final ReviewService reviewService;
    private final SseStreamingService sseStreamingService;

    public ReviewController(ReviewService reviewService, SseStreamingService sseStreamingService) {
        this.reviewService = reviewService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/reviews: Submit code for review. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submitReview(@RequestBody ReviewRequest request) {
        var input = new ReviewInput(request.code(), request.filename(), request.capabilities());
        String reviewId;
        try {
            reviewId = reviewService.submit(input, request.plan());
        } catch (IllegalArgumentException | PlanException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        log.info("Accepted review {} for {}", reviewId, input.filename());
        return ResponseEntity.accepted().body(Map.of(
                "review_id", reviewId,
                "status", ReviewStatus.RUNNING.wireName()
        ));
    }

    /**
     * GET /api/v1/reviews: List tracked reviews, newest first.
     */
    @GetMapping
    public ResponseEntity<List<ReviewResponse>> listReviews() {
        List<ReviewResponse> list = reviewService.all().stream()
                .sorted(Comparator.comparing(ReviewHandle::submittedAt).reversed())
                .map(ReviewResponse::summary)
                .toList();
        return ResponseEntity.ok(list);
    }

    /**
     * GET /api/v1/reviews/{id}: Review status, with the report once finished.
     */
    @GetMapping("/{id}")
    public ResponseEntity<ReviewResponse> getReview(@PathVariable String id) {
        Optional<ReviewHandle> handle = reviewService.find(id);
        return handle.map(h -> ResponseEntity.ok(ReviewResponse.of(h)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/reviews/{id}/events: SSE stream of review events, replaying what already happened.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (reviewService.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    /**
     * POST /api/v1/reviews/{id}/cancel: Cancel a running review. The report is still produced.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancelReview(@PathVariable String id) {
        Optional<ReviewHandle> handle = reviewService.find(id);
        if (handle.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean cancelled = reviewService.cancel(id);
        return ResponseEntity.ok(Map.of(
                "review_id", id,
                "cancelled", cancelled,
                "status", handle.get().status().wireName()
        ));
    }
}
