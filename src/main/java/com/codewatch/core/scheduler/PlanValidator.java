package com.codewatch.core.scheduler;

import com.codewatch.core.model.Plan;
import com.codewatch.core.model.PlanStep;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Rejects plans that are not executable DAGs over registered capabilities.
 */
public final class PlanValidator {

    private PlanValidator() {}

    /**
     * @param plan             plan to check
     * @param capabilityExists whether a capability id is registered
     * @throws PlanException describing the first problem found
     */
    public static void validate(Plan plan, Predicate<String> capabilityExists) {
        if (plan.steps().isEmpty()) {
            throw new PlanException(PlanException.Reason.EMPTY_PLAN,
                    "Plan " + plan.planId() + " has no steps");
        }

        var ids = new HashSet<String>();
        for (PlanStep step : plan.steps()) {
            if (!ids.add(step.stepId())) {
                throw new PlanException(PlanException.Reason.DUPLICATE_STEP,
                        "Duplicate step id: " + step.stepId());
            }
        }

        for (PlanStep step : plan.steps()) {
            if (!capabilityExists.test(step.capabilityId())) {
                throw new PlanException(PlanException.Reason.UNKNOWN_CAPABILITY,
                        "Step " + step.stepId() + " references unknown capability: " + step.capabilityId());
            }
            for (String dep : step.dependencies()) {
                if (!ids.contains(dep)) {
                    throw new PlanException(PlanException.Reason.UNKNOWN_DEPENDENCY,
                        "Step " + step.stepId() + " depends on unknown step: " + dep);
                }
            }
        }

        List<String> cyclic = stepsOnCycles(plan);
        if (!cyclic.isEmpty()) {
            throw new PlanException(PlanException.Reason.CYCLE,
                    "Plan " + plan.planId() + " contains a dependency cycle involving " + cyclic);
        }
    }

    /**
     * Kahn's algorithm: steps that never reach in-degree zero sit on or behind a cycle.
     * Returned in plan order.
     */
    static List<String> stepsOnCycles(Plan plan) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (PlanStep step : plan.steps()) {
            inDegree.put(step.stepId(), step.dependencies().size());
            for (String dep : step.dependencies()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(step.stepId());
            }
        }

        var queue = new ArrayDeque<String>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        Set<String> visited = new HashSet<>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            visited.add(id);
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }

        var remaining = new ArrayList<String>();
        for (PlanStep step : plan.steps()) {
            if (!visited.contains(step.stepId())) {
                remaining.add(step.stepId());
            }
        }
        return remaining;
    }
}
