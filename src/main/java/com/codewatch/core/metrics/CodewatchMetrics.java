package com.codewatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Codewatch review execution.
 */
@Service
public class CodewatchMetrics {

    private final MeterRegistry registry;

    public CodewatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("codewatch.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStepExecution(String capabilityId, boolean success, long ms) {
        Timer.builder("codewatch.step.duration")
                .tag("capability", capabilityId)
                .tag("result", success ? "completed" : "failed")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(String capabilityId, String errorKind) {
        Counter.builder("codewatch.retries.total")
                .tag("capability", capabilityId)
                .tag("kind", errorKind)
                .register(registry)
                .increment();
    }

    public void recordReviewResult(String status) {
        Counter.builder("codewatch.reviews.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordBatchSize(int size) {
        DistributionSummary.builder("codewatch.batch.size")
                .register(registry)
                .record(size);
    }

    public void recordDuplicatesRemoved(int count) {
        Counter.builder("codewatch.consolidation.duplicates_removed")
                .description("Findings folded into a higher-confidence duplicate")
                .register(registry)
                .increment(count);
    }

    public void recordFixRejected() {
        Counter.builder("codewatch.consolidation.fixes_rejected")
                .description("Fixes referencing an unknown finding")
                .register(registry)
                .increment();
    }

    public void recordSubscriberDropped(String reason) {
        Counter.builder("codewatch.events.subscribers_dropped")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
