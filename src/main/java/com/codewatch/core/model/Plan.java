package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * An immutable DAG of steps describing what analysis to run and in which order.
 * Only step state changes during execution, and that lives in the executor.
 *
 * @param planId unique plan id
 * @param steps  steps in plan order
 */
public record Plan(
    @JsonProperty("plan_id") String planId,
    List<PlanStep> steps
) implements Serializable {

    public Plan {
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("plan_id is required");
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public Optional<PlanStep> step(String stepId) {
        return steps.stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }
}
