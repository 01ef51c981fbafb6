package com.codewatch.dispatch.api;

import com.codewatch.core.engine.ReviewService;
import com.codewatch.core.events.EventBus;
import com.codewatch.core.events.ReviewEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges review event bus subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each connection subscribes with history replay, so a client that connects late still
 * sees the whole stream. The emitter completes when the review's bus closes. Periodic
 * heartbeat comments keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final ReviewService reviewService;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(ReviewService reviewService) {
        this(reviewService, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(ReviewService reviewService, long timeoutMs) {
        this.reviewService = reviewService;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError/onCompletion callbacks clean up
                log.debug("Heartbeat failed for review {}: {}", registration.reviewId, e.getMessage());
            }
        }
    }

    /**
     * Creates an SSE emitter streaming every event of the review.
     *
     * @throws com.codewatch.core.engine.ReviewNotFoundException if the review is unknown
     */
    public SseEmitter createEmitter(String reviewId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = reviewService.subscribe(reviewId,
                event -> sendEvent(emitter, event),
                true,
                emitter::complete);

        var registration = new EmitterRegistration(reviewId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for review {}", reviewId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for review {}: {}", reviewId, ex.getMessage());
            cleanup(registration);
        });

        log.info("SSE emitter created for review {} (timeout={}ms)", reviewId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, ReviewEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("review_id", event.reviewId());
        data.put("source_id", event.sourceId());
        data.put("sequence", event.sequence());
        if (event.stepId() != null) {
            data.put("step_id", event.stepId());
        }
        data.put("timestamp", event.timestamp().toString());
        data.put("payload", event.payload());
        try {
            emitter.send(SseEmitter.event()
                    .id(event.sourceId() + ":" + event.sequence())
                    .name(event.eventType())
                    .data(data));
        } catch (IOException e) {
            // The client went away; stop delivering to this subscription
            throw new IllegalStateException("SSE send failed for review " + event.reviewId(), e);
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String reviewId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
