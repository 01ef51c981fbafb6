package com.codewatch.core.engine;

import com.codewatch.core.capability.Capability;
import com.codewatch.core.capability.CapabilityContext;
import com.codewatch.core.capability.CapabilityRegistry;
import com.codewatch.core.config.CodewatchProperties;
import com.codewatch.core.consolidation.ConsolidatedFindings;
import com.codewatch.core.consolidation.ConsolidationResult;
import com.codewatch.core.consolidation.FindingConsolidator;
import com.codewatch.core.events.EventBus;
import com.codewatch.core.events.EventEmitter;
import com.codewatch.core.events.EventSink;
import com.codewatch.core.events.EventTypes;
import com.codewatch.core.logging.MdcContext;
import com.codewatch.core.metrics.CodewatchMetrics;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.FixVerification;
import com.codewatch.core.model.Plan;
import com.codewatch.core.model.PlanStep;
import com.codewatch.core.model.RejectedFix;
import com.codewatch.core.model.ReviewInput;
import com.codewatch.core.model.ReviewReport;
import com.codewatch.core.model.StepStatus;
import com.codewatch.core.plan.PlanCodec;
import com.codewatch.core.plan.PlanFactory;
import com.codewatch.core.retry.BackoffSleeper;
import com.codewatch.core.retry.RetryOutcome;
import com.codewatch.core.retry.RetrySupervisor;
import com.codewatch.core.scheduler.Batch;
import com.codewatch.core.scheduler.PlanException;
import com.codewatch.core.scheduler.PlanExecutor;
import com.codewatch.core.scheduler.PlanValidator;
import com.codewatch.core.scheduler.StepOutcome;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one review end to end: builds or validates the plan, dispatches steps in batches
 * through the retry supervisor, consolidates findings at every barrier, and writes the
 * final report. The coordinator is the only writer of consolidated state and of the report.
 */
@Service
public class ReviewCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ReviewCoordinator.class);

    public static final String COORDINATOR_SOURCE = "coordinator";
    public static final String SYSTEM_SOURCE = "system";

    private final CapabilityRegistry registry;
    private final PlanFactory planFactory;
    private final FindingConsolidator consolidator;
    private final RetrySupervisor supervisor;
    private final ExecutorService stepExecutor;
    private final ExecutorService invocationExecutor;
    private final CodewatchMetrics metrics;
    private final ReportAssembler assembler = new ReportAssembler();

    @Autowired
    public ReviewCoordinator(CapabilityRegistry registry, PlanFactory planFactory,
                             FindingConsolidator consolidator, CodewatchProperties properties,
                             CodewatchMetrics metrics) {
        this.registry = registry;
        this.planFactory = planFactory;
        this.consolidator = consolidator;
        this.metrics = metrics;
        this.stepExecutor = Executors.newFixedThreadPool(
                Math.max(1, properties.getMaxParallel()), named("codewatch-step-"));
        this.invocationExecutor = Executors.newCachedThreadPool(named("codewatch-capability-"));
        this.supervisor = new RetrySupervisor(properties.retryPolicy(), properties.getCapabilityTimeout(),
                invocationExecutor, BackoffSleeper.CANCELLABLE, metrics);
        log.info("Review coordinator ready: maxParallel={}, retry={}, timeout={}",
                properties.getMaxParallel(), properties.retryPolicy(), properties.getCapabilityTimeout());
    }

    /**
     * Constructor for tests: supervisor and step pool supplied by the caller.
     */
    public ReviewCoordinator(CapabilityRegistry registry, PlanFactory planFactory,
                             FindingConsolidator consolidator, RetrySupervisor supervisor,
                             ExecutorService stepExecutor, CodewatchMetrics metrics) {
        this.registry = registry;
        this.planFactory = planFactory;
        this.consolidator = consolidator;
        this.supervisor = supervisor;
        this.stepExecutor = stepExecutor;
        this.invocationExecutor = null;
        this.metrics = metrics;
    }

    @PreDestroy
    public void shutdown() {
        stepExecutor.shutdownNow();
        if (invocationExecutor != null) {
            invocationExecutor.shutdownNow();
        }
    }

    /**
     * @throws PlanException if the plan is not executable against the registered capabilities
     */
    public void validate(Plan plan) {
        PlanValidator.validate(plan, registry::contains);
    }

    /**
     * Runs a review with the default plan for its input.
     */
    public ReviewReport review(String reviewId, ReviewInput input, EventBus bus, CancellationToken cancellation) {
        return review(reviewId, input, null, bus, cancellation);
    }

    /**
     * Runs a review.
     *
     * @param plan explicit plan, or {@code null} to build the default plan
     * @return the final report; never {@code null}
     * @throws PlanException if the plan cannot be built or is not executable
     */
    public ReviewReport review(String reviewId, ReviewInput input, Plan plan, EventBus bus,
                               CancellationToken cancellation) {
        MdcContext.setReview(reviewId);
        long start = System.currentTimeMillis();
        EventEmitter system = bus.emitter(SYSTEM_SOURCE);
        EventEmitter coordinator = bus.emitter(COORDINATOR_SOURCE);
        try {
            log.info("Starting review {} of {} ({} lines)", reviewId, input.filename(), input.lineCount());
            system.emit(EventTypes.REVIEW_STARTED, Map.of(
                    "filename", input.filename(),
                    "lines", input.lineCount(),
                    "capabilities", input.capabilities()));

            PlanExecutor executor;
            try {
                Plan effective = plan != null ? plan : planFactory.createPlan(reviewId, input);
                executor = new PlanExecutor(effective, registry::contains);
            } catch (PlanException e) {
                log.error("Review {} has no executable plan: {}", reviewId, e.getMessage());
                coordinator.emit(EventTypes.AGENT_ERROR, Map.of(
                        "agent", COORDINATOR_SOURCE,
                        "error_type", "plan_error",
                        "message", e.getMessage(),
                        "recoverable", false));
                system.emit(EventTypes.REVIEW_COMPLETED, Map.of(
                        "status", "failed",
                        "error", e.getMessage(),
                        "duration_ms", System.currentTimeMillis() - start));
                record("failed");
                throw e;
            }
            if (metrics != null) {
                metrics.recordPlanningDuration(System.currentTimeMillis() - start);
            }

            coordinator.emit(EventTypes.PLAN_CREATED, PlanCodec.toRepresentation(executor.plan()));
            var run = new ReviewRun(reviewId, executor.plan(), input, bus, coordinator, cancellation);
            Map<String, StepOutcome> outcomes = executor.execute(run::dispatch, run::onBatchResolved, cancellation);

            ReviewReport report = run.report(outcomes, System.currentTimeMillis() - start);
            coordinator.emit(EventTypes.FINAL_REPORT, reportPayload(report));
            system.emit(EventTypes.REVIEW_COMPLETED, Map.of(
                    "status", report.status().wireName(),
                    "cancelled", report.cancelled(),
                    "duration_ms", report.metrics().durationMs()));
            record(report.status().wireName());
            log.info("Review {} finished {}: {}", reviewId, report.status().wireName(), report.summary());
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private void record(String status) {
        if (metrics != null) {
            metrics.recordReviewResult(status);
        }
    }

    static Map<String, Object> reportPayload(ReviewReport report) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("review_id", report.reviewId());
        payload.put("plan_id", report.planId());
        payload.put("status", report.status().wireName());
        payload.put("summary", report.summary());
        payload.put("cancelled", report.cancelled());
        payload.put("findings", report.findings());
        payload.put("fixes", report.fixes());
        payload.put("errors", report.errors());
        payload.put("metrics", report.metrics());
        return payload;
    }

    /**
     * Mutable state of one review execution. Consolidated state is read and replaced only
     * on the coordinator thread: at dispatch and at barriers.
     */
    private final class ReviewRun {
        private final String reviewId;
        private final Plan plan;
        private final ReviewInput input;
        private final EventBus bus;
        private final EventEmitter coordinator;
        private final CancellationToken cancellation;
        private final List<String> errors = new ArrayList<>();
        private ConsolidatedFindings state = ConsolidatedFindings.EMPTY;

        private ReviewRun(String reviewId, Plan plan, ReviewInput input, EventBus bus,
                          EventEmitter coordinator, CancellationToken cancellation) {
            this.reviewId = reviewId;
            this.plan = plan;
            this.input = input;
            this.bus = bus;
            this.coordinator = coordinator;
            this.cancellation = cancellation;
        }

        CompletableFuture<StepOutcome> dispatch(PlanStep step, Set<String> failedDependencies) {
            Capability capability = registry.require(step.capabilityId());
            var context = new CapabilityContext(reviewId, plan.planId(), step.stepId(), capability.id(), 1,
                    failedDependencies, state.findings(), state.fixes(), cancellation);

            var payload = new LinkedHashMap<String, Object>();
            payload.put("step_id", step.stepId());
            payload.put("capability_id", capability.id());
            payload.put("agent", capability.sourceId());
            payload.put("parallel", step.parallel());
            payload.put("upstream_failed", context.upstreamFailed());
            payload.put("failed_dependencies", List.copyOf(failedDependencies));
            coordinator.emit(EventTypes.PLAN_STEP_STARTED, step.stepId(), payload);
            if (context.upstreamFailed()) {
                log.warn("Step {} runs with failed dependencies {}", step.stepId(), failedDependencies);
            }
            return CompletableFuture.supplyAsync(() -> runStep(step, capability, context), stepExecutor);
        }

        private StepOutcome runStep(PlanStep step, Capability capability, CapabilityContext context) {
            MdcContext.setStep(reviewId, step.stepId(), capability.id());
            try {
                EventSink sink = bus.emitter(capability.sourceId()).forStep(step.stepId());
                RetryOutcome retry = supervisor.invoke(capability, input, context, sink);

                StepOutcome outcome;
                if (retry.succeeded()) {
                    outcome = StepOutcome.completed(step.stepId(), capability.id(), retry.result(),
                            retry.attempts(), retry.durationMs(), context.failedDependencies());
                } else if (retry.cancelled()) {
                    outcome = new StepOutcome(step.stepId(), capability.id(), StepStatus.FAILED, null,
                            retry.attempts(), retry.durationMs(), "cancelled", context.failedDependencies(), true);
                } else {
                    outcome = StepOutcome.failed(step.stepId(), capability.id(), retry.errorMessage(),
                            retry.attempts(), retry.durationMs(), context.failedDependencies());
                    var error = new LinkedHashMap<String, Object>();
                    error.put("agent", capability.sourceId());
                    error.put("error_type", retry.error() != null ? retry.error().kind().wireName() : "internal");
                    error.put("message", retry.errorMessage());
                    error.put("recoverable", retry.error() != null && retry.error().isRecoverable());
                    error.put("attempts", retry.attempts());
                    coordinator.emit(EventTypes.AGENT_ERROR, step.stepId(), error);
                }

                var payload = new LinkedHashMap<String, Object>();
                payload.put("step_id", step.stepId());
                payload.put("capability_id", capability.id());
                payload.put("status", outcome.status().wireName());
                payload.put("success", outcome.succeeded());
                payload.put("attempts", outcome.attempts());
                payload.put("duration_ms", outcome.durationMs());
                if (outcome.succeeded()) {
                    payload.put("findings", outcome.result().findings().size());
                    payload.put("fixes", outcome.result().fixes().size());
                } else {
                    payload.put("error", outcome.error());
                }
                coordinator.emit(EventTypes.PLAN_STEP_COMPLETED, step.stepId(), payload);

                if (metrics != null) {
                    metrics.recordStepExecution(capability.id(), outcome.succeeded(), outcome.durationMs());
                }
                log.info("Step {} {} after {} attempt(s) in {}ms", step.stepId(),
                        outcome.status().wireName(), outcome.attempts(), outcome.durationMs());
                return outcome;
            } finally {
                MdcContext.clear();
            }
        }

        void onBatchResolved(Batch batch, List<StepOutcome> outcomes) {
            MdcContext.setBatch(reviewId, batch.number());
            if (metrics != null) {
                metrics.recordBatchSize(batch.steps().size());
            }

            var findings = new ArrayList<Finding>();
            var fixes = new ArrayList<Fix>();
            var fixStepIds = new HashMap<String, String>();
            var verifications = new ArrayList<FixVerification>();
            for (StepOutcome outcome : outcomes) {
                if (!outcome.succeeded()) {
                    continue;
                }
                findings.addAll(outcome.result().findings());
                for (Fix fix : outcome.result().fixes()) {
                    fixes.add(fix);
                    fixStepIds.put(fix.fixId(), outcome.stepId());
                }
                verifications.addAll(outcome.result().verifications());
            }

            ConsolidationResult result = consolidator.consolidate(state, findings, fixes, fixStepIds);
            state = result.state();
            for (RejectedFix rejected : result.rejected()) {
                coordinator.emit(EventTypes.FIX_REJECTED, rejected.stepId(), Map.of(
                        "fix_id", rejected.fixId(),
                        "finding_id", rejected.findingId(),
                        "reason", rejected.reason()));
                if (metrics != null) {
                    metrics.recordFixRejected();
                }
            }
            if (metrics != null && result.duplicatesRemoved() > 0) {
                metrics.recordDuplicatesRemoved(result.duplicatesRemoved());
            }
            for (FixVerification verification : verifications) {
                applyVerification(verification);
            }

            var payload = new LinkedHashMap<String, Object>();
            payload.put("batch", batch.number());
            payload.put("steps", batch.stepIds());
            payload.put("new_findings", result.added().size());
            payload.put("duplicates_removed", result.duplicatesRemoved());
            payload.put("rejected_fixes", result.rejected().size());
            payload.put("total_findings", state.findings().size());
            payload.put("total_fixes", state.fixes().size());
            coordinator.emit(EventTypes.FINDINGS_CONSOLIDATED, payload);
            log.info("Batch #{} consolidated: {} new, {} duplicates removed, {} total findings",
                    batch.number(), result.added().size(), result.duplicatesRemoved(), state.findings().size());
        }

        private void applyVerification(FixVerification verification) {
            Optional<Fix> fix = state.fix(verification.fixId());
            if (fix.isEmpty()) {
                log.warn("Verification for unknown fix {}", verification.fixId());
                errors.add("verification for unknown fix " + verification.fixId());
                return;
            }
            try {
                state = state.withFix(fix.get().resolve(verification.passed()));
            } catch (IllegalStateException e) {
                log.warn("Ignoring second verification: {}", e.getMessage());
                errors.add(e.getMessage());
            }
        }

        ReviewReport report(Map<String, StepOutcome> outcomes, long durationMs) {
            boolean cancelled = cancellation.isCancelled();
            try {
                return assembler.assemble(reviewId, plan, outcomes, state, errors, cancelled, durationMs);
            } catch (AllCapabilitiesFailedException e) {
                log.error("Review {}: {}", reviewId, e.getMessage());
                return assembler.failureReport(reviewId, plan, outcomes, errors, cancelled, durationMs);
            }
        }
    }

    private static ThreadFactory named(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
