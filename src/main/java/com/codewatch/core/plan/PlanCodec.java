package com.codewatch.core.plan;

import com.codewatch.core.CodewatchException;
import com.codewatch.core.model.Plan;
import com.codewatch.core.model.PlanStep;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes plans as JSON:
 * {@code {"plan_id": ..., "steps": [{"step_id", "capability_id", "dependencies", "parallel"}]}}.
 */
public final class PlanCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PlanCodec() {}

    public static String toJson(Plan plan) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toRepresentation(plan));
        } catch (JsonProcessingException e) {
            throw new CodewatchException("Failed to serialize plan " + plan.planId(), e);
        }
    }

    /**
     * Parses a plan. The result is not validated; execution validates it.
     *
     * @throws CodewatchException if the JSON is malformed or lacks required fields
     */
    public static Plan fromJson(String json) {
        try {
            Plan plan = MAPPER.readValue(json, Plan.class);
            if (plan == null) {
                throw new CodewatchException("Plan JSON is empty");
            }
            return plan;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CodewatchException("Invalid plan JSON: " + e.getMessage(), e);
        }
    }

    /** Plan as plain maps and lists, as carried in {@code plan_created} events. */
    public static Map<String, Object> toRepresentation(Plan plan) {
        var steps = new ArrayList<Map<String, Object>>();
        for (PlanStep step : plan.steps()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("step_id", step.stepId());
            entry.put("capability_id", step.capabilityId());
            entry.put("dependencies", List.copyOf(step.dependencies()));
            entry.put("parallel", step.parallel());
            if (step.description() != null) {
                entry.put("description", step.description());
            }
            steps.add(entry);
        }
        var representation = new LinkedHashMap<String, Object>();
        representation.put("plan_id", plan.planId());
        representation.put("steps", steps);
        return representation;
    }
}
