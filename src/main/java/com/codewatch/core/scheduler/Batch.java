package com.codewatch.core.scheduler;

import com.codewatch.core.model.PlanStep;

import java.util.List;

/**
 * A set of ready steps dispatched together and resolved behind one barrier.
 *
 * @param number   1-based batch number within the review
 * @param steps    steps in plan order
 * @param parallel whether the steps fan out concurrently
 */
public record Batch(int number, List<PlanStep> steps, boolean parallel) {

    public Batch {
        steps = List.copyOf(steps);
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public List<String> stepIds() {
        return steps.stream().map(PlanStep::stepId).toList();
    }
}
