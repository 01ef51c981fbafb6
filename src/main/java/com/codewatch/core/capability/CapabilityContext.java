package com.codewatch.core.capability;

import com.codewatch.core.engine.CancellationToken;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Fix;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * What a capability knows about the step it is running.
 *
 * @param reviewId           review being executed
 * @param planId             plan being executed
 * @param stepId             canonical id of the step; findings must carry it
 * @param capabilityId       registry key of the invoked capability
 * @param attempt            1-based attempt number
 * @param failedDependencies dependencies of this step that ended failed
 * @param findings           findings consolidated by earlier batches
 * @param fixes              fixes consolidated by earlier batches
 * @param cancellation       review cancellation signal
 */
public record CapabilityContext(
    String reviewId,
    String planId,
    String stepId,
    String capabilityId,
    int attempt,
    Set<String> failedDependencies,
    List<Finding> findings,
    List<Fix> fixes,
    CancellationToken cancellation
) {

    public CapabilityContext {
        failedDependencies = failedDependencies == null ? Set.of() : Set.copyOf(failedDependencies);
        findings = findings == null ? List.of() : List.copyOf(findings);
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
        cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }

    /** Whether any dependency of this step failed. */
    public boolean upstreamFailed() {
        return !failedDependencies.isEmpty();
    }

    public CapabilityContext withAttempt(int attempt) {
        return new CapabilityContext(reviewId, planId, stepId, capabilityId, attempt,
                failedDependencies, findings, fixes, cancellation);
    }

    public Optional<Finding> finding(String findingId) {
        return findings.stream().filter(f -> f.findingId().equals(findingId)).findFirst();
    }
}
