package com.codewatch.core.plan;

import com.codewatch.core.capability.Capability;
import com.codewatch.core.capability.CapabilityRegistry;
import com.codewatch.core.capability.CapabilityRole;
import com.codewatch.core.model.Plan;
import com.codewatch.core.model.PlanStep;
import com.codewatch.core.model.ReviewInput;
import com.codewatch.core.scheduler.PlanException;
import com.codewatch.core.scheduler.PlanValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the default review plan: every requested analysis capability as a parallel
 * step, followed by one sequential verification step that depends on all of them.
 * The same input always yields the same plan.
 */
@Component
public class PlanFactory {

    private static final Logger log = LoggerFactory.getLogger(PlanFactory.class);

    private final CapabilityRegistry registry;

    public PlanFactory(CapabilityRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws PlanException if the input names an unknown capability or no analysis step remains
     */
    public Plan createPlan(String reviewId, ReviewInput input) {
        List<Capability> analysis = selectAnalysis(input.capabilities());

        var steps = new ArrayList<PlanStep>();
        Set<String> analysisIds = new LinkedHashSet<>();
        int index = 1;
        for (Capability capability : analysis) {
            String stepId = "step-" + index++ + "-" + capability.id();
            steps.add(new PlanStep(stepId, capability.id(), Set.of(), true, capability.description()));
            analysisIds.add(stepId);
        }

        List<Capability> verifiers = registry.withRole(CapabilityRole.VERIFICATION);
        if (!analysisIds.isEmpty() && !verifiers.isEmpty()) {
            Capability verifier = verifiers.get(0);
            steps.add(new PlanStep("step-" + index + "-" + verifier.id(), verifier.id(),
                    analysisIds, false, verifier.description()));
        }

        var plan = new Plan(planIdFor(reviewId), steps);
        PlanValidator.validate(plan, registry::contains);
        log.info("Created plan {} with steps {}", plan.planId(),
                plan.steps().stream().map(PlanStep::stepId).toList());
        return plan;
    }

    public static String planIdFor(String reviewId) {
        return "plan-" + reviewId;
    }

    private List<Capability> selectAnalysis(List<String> requested) {
        List<Capability> available = registry.withRole(CapabilityRole.ANALYSIS);
        if (requested.isEmpty()) {
            return available;
        }
        for (String id : requested) {
            if (!registry.contains(id)) {
                throw new PlanException(PlanException.Reason.UNKNOWN_CAPABILITY, "Unknown capability: " + id);
            }
        }
        var wanted = new LinkedHashSet<>(requested);
        List<Capability> selected = available.stream().filter(c -> wanted.contains(c.id())).toList();
        if (selected.isEmpty()) {
            throw new PlanException(PlanException.Reason.EMPTY_PLAN,
                    "No analysis capability among " + requested);
        }
        return selected;
    }
}
