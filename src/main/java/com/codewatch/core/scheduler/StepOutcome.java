package com.codewatch.core.scheduler;

import com.codewatch.core.model.CapabilityResult;
import com.codewatch.core.model.StepStatus;

import java.util.Set;

/**
 * How one step resolved.
 *
 * @param stepId             the step
 * @param capabilityId       capability that ran it
 * @param status             {@link StepStatus#COMPLETED} or {@link StepStatus#FAILED}
 * @param result             capability result when completed
 * @param attempts           invocations made
 * @param durationMs         wall time
 * @param error              failure message (nullable)
 * @param failedDependencies dependencies that had failed at dispatch
 * @param cancelled          whether the step failed because the review was cancelled
 */
public record StepOutcome(
    String stepId,
    String capabilityId,
    StepStatus status,
    CapabilityResult result,
    int attempts,
    long durationMs,
    String error,
    Set<String> failedDependencies,
    boolean cancelled
) {

    public StepOutcome {
        if (status != StepStatus.COMPLETED && status != StepStatus.FAILED) {
            throw new IllegalArgumentException("Outcome status must be resolved, got " + status);
        }
        failedDependencies = failedDependencies == null ? Set.of() : Set.copyOf(failedDependencies);
    }

    public static StepOutcome completed(String stepId, String capabilityId, CapabilityResult result,
                                        int attempts, long durationMs, Set<String> failedDependencies) {
        return new StepOutcome(stepId, capabilityId, StepStatus.COMPLETED, result, attempts,
                durationMs, null, failedDependencies, false);
    }

    public static StepOutcome failed(String stepId, String capabilityId, String error,
                                     int attempts, long durationMs, Set<String> failedDependencies) {
        return new StepOutcome(stepId, capabilityId, StepStatus.FAILED, null, attempts,
                durationMs, error, failedDependencies, false);
    }

    public static StepOutcome cancelled(String stepId, String capabilityId, int attempts, long durationMs) {
        return new StepOutcome(stepId, capabilityId, StepStatus.FAILED, null, attempts,
                durationMs, "cancelled", Set.of(), true);
    }

    public boolean succeeded() {
        return status == StepStatus.COMPLETED;
    }

    public boolean upstreamFailed() {
        return !failedDependencies.isEmpty();
    }
}
