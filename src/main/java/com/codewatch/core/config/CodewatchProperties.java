package com.codewatch.core.config;

import com.codewatch.core.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "codewatch")
public class CodewatchProperties {

    private Retry retry = new Retry();
    private Capability capability = new Capability();
    private Executor executor = new Executor();
    private Events events = new Events();
    private Consolidation consolidation = new Consolidation();
    private Review review = new Review();

    // -- Derived accessors --

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retry.maxAttempts,
                Duration.ofMillis(retry.baseDelayMs),
                Duration.ofMillis(retry.maxDelayMs));
    }

    public Duration getCapabilityTimeout() { return Duration.ofSeconds(capability.timeoutSeconds); }
    public int getMaxParallel() { return executor.maxParallel; }
    public int getHistorySize() { return events.historySize; }
    public int getSubscriberQueueCapacity() { return events.subscriberQueueCapacity; }
    public double getLineOverlapThreshold() { return consolidation.lineOverlapThreshold; }
    public int getMaxCodeBytes() { return review.maxCodeBytes; }
    public Duration getReviewRetention() { return Duration.ofMinutes(review.retentionMinutes); }
    public int getMaxRetainedReviews() { return review.maxRetained; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Capability getCapability() { return capability; }
    public void setCapability(Capability capability) { this.capability = capability; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Consolidation getConsolidation() { return consolidation; }
    public void setConsolidation(Consolidation consolidation) { this.consolidation = consolidation; }
    public Review getReview() { return review; }
    public void setReview(Review review) { this.review = review; }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 400;
        private long maxDelayMs = 3000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
    }

    public static class Capability {
        private int timeoutSeconds = 120;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Executor {
        private int maxParallel = 3;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    }

    public static class Events {
        private int historySize = 1000;
        private int subscriberQueueCapacity = 1024;

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
        public int getSubscriberQueueCapacity() { return subscriberQueueCapacity; }
        public void setSubscriberQueueCapacity(int subscriberQueueCapacity) { this.subscriberQueueCapacity = subscriberQueueCapacity; }
    }

    public static class Consolidation {
        /** Minimum share of the shorter line range two findings must overlap to count as duplicates. */
        private double lineOverlapThreshold = 0.5;

        public double getLineOverlapThreshold() { return lineOverlapThreshold; }
        public void setLineOverlapThreshold(double lineOverlapThreshold) { this.lineOverlapThreshold = lineOverlapThreshold; }
    }

    public static class Review {
        private int maxCodeBytes = 100_000;
        /** How long a finished review stays queryable. */
        private long retentionMinutes = 60;
        /** Upper bound on finished reviews kept; the oldest finished go first. */
        private int maxRetained = 500;

        public int getMaxCodeBytes() { return maxCodeBytes; }
        public void setMaxCodeBytes(int maxCodeBytes) { this.maxCodeBytes = maxCodeBytes; }
        public long getRetentionMinutes() { return retentionMinutes; }
        public void setRetentionMinutes(long retentionMinutes) { this.retentionMinutes = retentionMinutes; }
        public int getMaxRetained() { return maxRetained; }
        public void setMaxRetained(int maxRetained) { this.maxRetained = maxRetained; }
    }
}
