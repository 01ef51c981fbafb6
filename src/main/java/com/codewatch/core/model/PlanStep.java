package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One unit of plan execution, bound to a capability and a dependency set.
 *
 * @param stepId       canonical step id, unique within its plan
 * @param capabilityId registry key of the capability to invoke
 * @param dependencies ids of steps that must resolve first
 * @param parallel     whether the step may run in a fan-out batch with other ready steps
 * @param description  human-readable purpose (nullable)
 */
public record PlanStep(
    @JsonProperty("step_id") String stepId,
    @JsonProperty("capability_id") String capabilityId,
    Set<String> dependencies,
    boolean parallel,
    String description
) implements Serializable {

    @JsonCreator
    public PlanStep {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("step_id is required");
        }
        if (capabilityId == null || capabilityId.isBlank()) {
            throw new IllegalArgumentException("capability_id is required for step " + stepId);
        }
        dependencies = dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public PlanStep(String stepId, String capabilityId, Set<String> dependencies, boolean parallel) {
        this(stepId, capabilityId, dependencies, parallel, null);
    }
}
