package com.codewatch.core.engine;

import com.codewatch.core.consolidation.ConsolidatedFindings;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.FindingCategory;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.Plan;
import com.codewatch.core.model.PlanStep;
import com.codewatch.core.model.ReportMetrics;
import com.codewatch.core.model.ReviewReport;
import com.codewatch.core.model.ReviewStatus;
import com.codewatch.core.model.Severity;
import com.codewatch.core.model.StepResult;
import com.codewatch.core.model.StepStatus;
import com.codewatch.core.model.VerificationStatus;
import com.codewatch.core.scheduler.StepOutcome;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the final report from step outcomes and the consolidated findings.
 * <p>
 * Status follows the step outcomes: every step completed gives {@code completed}, some
 * failed gives {@code partial}, all failed raises {@link AllCapabilitiesFailedException}.
 */
public class ReportAssembler {

    static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparingInt((Finding f) -> f.severity().rank())
            .thenComparing(f -> f.location().file(), Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(f -> f.location().lineStart());

    /**
     * @throws AllCapabilitiesFailedException if no step completed
     */
    public ReviewReport assemble(String reviewId, Plan plan, Map<String, StepOutcome> outcomes,
                                 ConsolidatedFindings state, List<String> extraErrors,
                                 boolean cancelled, long durationMs) {
        List<StepResult> stepResults = stepResults(plan, outcomes);
        List<String> errors = errors(stepResults, extraErrors);
        int completed = count(stepResults, StepStatus.COMPLETED);
        int failed = stepResults.size() - completed;
        if (completed == 0) {
            throw new AllCapabilitiesFailedException(reviewId, errors);
        }
        ReviewStatus status = failed > 0 ? ReviewStatus.PARTIAL : ReviewStatus.COMPLETED;

        var findings = new ArrayList<>(state.findings());
        findings.sort(REPORT_ORDER);

        var metrics = new ReportMetrics(durationMs, findings.size(), bySeverity(findings),
                byCategory(findings), state.duplicatesRemoved(), fixesVerified(state.fixes()),
                completed, failed, totalAttempts(stepResults));

        return new ReviewReport(reviewId, plan.planId(), status,
                summary(findings, completed, stepResults.size(), cancelled),
                findings, state.fixes(), state.rejectedFixes(), stepResults, errors, cancelled, metrics);
    }

    /** Report for a review in which no step completed. Carries no findings or fixes. */
    public ReviewReport failureReport(String reviewId, Plan plan, Map<String, StepOutcome> outcomes,
                                      List<String> extraErrors, boolean cancelled, long durationMs) {
        List<StepResult> stepResults = stepResults(plan, outcomes);
        List<String> errors = errors(stepResults, extraErrors);
        var metrics = new ReportMetrics(durationMs, 0, Map.of(), Map.of(), 0, 0,
                0, stepResults.size(), totalAttempts(stepResults));
        String summary = "Review failed: all " + stepResults.size() + " steps failed"
                + (cancelled ? " (cancelled)" : "");
        return new ReviewReport(reviewId, plan.planId(), ReviewStatus.FAILED, summary,
                List.of(), List.of(), List.of(), stepResults, errors, cancelled, metrics);
    }

    private List<StepResult> stepResults(Plan plan, Map<String, StepOutcome> outcomes) {
        var results = new ArrayList<StepResult>();
        for (PlanStep step : plan.steps()) {
            StepOutcome outcome = outcomes.get(step.stepId());
            if (outcome == null) {
                results.add(new StepResult(step.stepId(), step.capabilityId(), StepStatus.FAILED,
                        0, 0, "not executed", false));
                continue;
            }
            results.add(new StepResult(step.stepId(), step.capabilityId(), outcome.status(),
                    outcome.attempts(), outcome.durationMs(), outcome.error(), outcome.upstreamFailed()));
        }
        return results;
    }

    private static List<String> errors(List<StepResult> stepResults, List<String> extraErrors) {
        var errors = new ArrayList<String>();
        for (StepResult result : stepResults) {
            if (result.status() == StepStatus.FAILED) {
                errors.add(result.stepId() + ": " + result.error());
            }
        }
        errors.addAll(extraErrors);
        return errors;
    }

    private static int count(List<StepResult> results, StepStatus status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }

    private static int totalAttempts(List<StepResult> results) {
        return results.stream().mapToInt(StepResult::attempts).sum();
    }

    private static int fixesVerified(List<Fix> fixes) {
        return (int) fixes.stream().filter(f -> f.verificationStatus() == VerificationStatus.VERIFIED).count();
    }

    static Map<String, Integer> bySeverity(List<Finding> findings) {
        var counts = new LinkedHashMap<String, Integer>();
        for (Severity severity : Severity.values()) {
            int n = (int) findings.stream().filter(f -> f.severity() == severity).count();
            if (n > 0) {
                counts.put(severity.wireName(), n);
            }
        }
        return counts;
    }

    static Map<String, Integer> byCategory(List<Finding> findings) {
        var counts = new LinkedHashMap<String, Integer>();
        for (FindingCategory category : FindingCategory.values()) {
            int n = (int) findings.stream().filter(f -> f.category() == category).count();
            if (n > 0) {
                counts.put(category.wireName(), n);
            }
        }
        return counts;
    }

    private static String summary(List<Finding> findings, int completed, int total, boolean cancelled) {
        var summary = new StringBuilder();
        if (findings.isEmpty()) {
            summary.append("No issues found");
        } else {
            summary.append("Found ").append(findings.size()).append(" issue(s)");
            var parts = new ArrayList<String>();
            bySeverity(findings).forEach((severity, n) -> parts.add(n + " " + severity));
            summary.append(" (").append(String.join(", ", parts)).append(")");
        }
        summary.append("; ").append(completed).append("/").append(total).append(" steps completed");
        if (cancelled) {
            summary.append("; cancelled");
        }
        return summary.toString();
    }
}
