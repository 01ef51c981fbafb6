package com.codewatch.core.scheduler;

import com.codewatch.core.engine.CancellationToken;
import com.codewatch.core.model.Plan;
import com.codewatch.core.model.PlanStep;
import com.codewatch.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;

/**
 * Drives a validated plan to completion in dependency-ordered batches.
 * <p>
 * Owns every step's status; each step moves {@code PENDING -> READY -> RUNNING} and then to
 * {@code COMPLETED} or {@code FAILED} exactly once, so no step is dispatched twice. A failed
 * dependency still resolves its dependents, which run with the failure flagged. On
 * cancellation, steps not yet dispatched resolve as failed with reason {@code cancelled}.
 * One executor runs one plan once.
 */
public class PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    private final Plan plan;
    private final BatchScheduler scheduler;
    private final Map<String, StepStatus> statuses = new LinkedHashMap<>();
    private final Map<String, StepOutcome> outcomes = new LinkedHashMap<>();
    private int batchCount;
    private boolean started;

    /**
     * @throws PlanException if the plan is not an executable DAG
     */
    public PlanExecutor(Plan plan, Predicate<String> capabilityExists) {
        this(plan, capabilityExists, new BatchScheduler());
    }

    PlanExecutor(Plan plan, Predicate<String> capabilityExists, BatchScheduler scheduler) {
        PlanValidator.validate(plan, capabilityExists);
        this.plan = plan;
        this.scheduler = scheduler;
        for (PlanStep step : plan.steps()) {
            statuses.put(step.stepId(), StepStatus.PENDING);
        }
    }

    public Plan plan() {
        return plan;
    }

    /**
     * Runs the plan until every step has resolved.
     *
     * @return outcome of every step, in plan order
     */
    public Map<String, StepOutcome> execute(StepDispatcher dispatcher, BatchListener listener,
                                            CancellationToken cancellation) {
        synchronized (this) {
            if (started) {
                throw new IllegalStateException("Plan " + plan.planId() + " already executed");
            }
            started = true;
        }
        log.info("Executing plan {} with {} steps", plan.planId(), plan.steps().size());

        while (!isDone()) {
            if (cancellation.isCancelled()) {
                resolvePendingAsCancelled();
                break;
            }
            Batch batch;
            synchronized (this) {
                batch = scheduler.nextBatch(plan.steps(), statuses, batchCount + 1);
            }
            if (batch.isEmpty()) {
                throw new IllegalStateException("No step ready in plan " + plan.planId()
                        + " while unresolved steps remain: " + snapshot());
            }
            batchCount++;
            List<StepOutcome> resolved = runBatch(batch, dispatcher);
            listener.onBatchResolved(batch, resolved);
        }

        log.info("Plan {} resolved after {} batches", plan.planId(), batchCount);
        return outcomes();
    }

    private List<StepOutcome> runBatch(Batch batch, StepDispatcher dispatcher) {
        log.info("Dispatching batch #{} ({}): {}", batch.number(),
                batch.parallel() ? "parallel" : "sequential", batch.stepIds());

        for (PlanStep step : batch.steps()) {
            transition(step.stepId(), StepStatus.PENDING, StepStatus.READY);
        }

        var futures = new ArrayList<CompletableFuture<StepOutcome>>();
        for (PlanStep step : batch.steps()) {
            Set<String> failedDeps = failedDependencies(step);
            transition(step.stepId(), StepStatus.READY, StepStatus.RUNNING);
            CompletableFuture<StepOutcome> future;
            try {
                future = dispatcher.dispatch(step, failedDeps);
            } catch (RuntimeException e) {
                log.error("Dispatch of step {} failed: {}", step.stepId(), e.getMessage(), e);
                future = CompletableFuture.failedFuture(e);
            }
            futures.add(future);
        }

        // Barrier: every step of the batch resolves before anything else is scheduled
        var resolved = new ArrayList<StepOutcome>();
        for (int i = 0; i < futures.size(); i++) {
            PlanStep step = batch.steps().get(i);
            StepOutcome outcome = await(step, futures.get(i));
            transition(step.stepId(), StepStatus.RUNNING, outcome.status());
            synchronized (this) {
                outcomes.put(step.stepId(), outcome);
            }
            resolved.add(outcome);
        }
        return resolved;
    }

    private StepOutcome await(PlanStep step, CompletableFuture<StepOutcome> future) {
        try {
            StepOutcome outcome = future.join();
            if (outcome == null || !outcome.stepId().equals(step.stepId())) {
                return StepOutcome.failed(step.stepId(), step.capabilityId(),
                        "Dispatcher returned no outcome for step", 0, 0, failedDependencies(step));
            }
            return outcome;
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Step {} ended abnormally: {}", step.stepId(), cause.getMessage(), cause);
            return StepOutcome.failed(step.stepId(), step.capabilityId(),
                    "internal: " + cause.getMessage(), 0, 0, failedDependencies(step));
        }
    }

    private void resolvePendingAsCancelled() {
        for (PlanStep step : plan.steps()) {
            synchronized (this) {
                if (statuses.get(step.stepId()) != StepStatus.PENDING) {
                    continue;
                }
                statuses.put(step.stepId(), StepStatus.FAILED);
                outcomes.put(step.stepId(), StepOutcome.cancelled(step.stepId(), step.capabilityId(), 0, 0));
            }
            log.info("Step {} not dispatched: review cancelled", step.stepId());
        }
    }

    private synchronized Set<String> failedDependencies(PlanStep step) {
        var failed = new LinkedHashSet<String>();
        for (String dep : step.dependencies()) {
            if (statuses.get(dep) == StepStatus.FAILED) {
                failed.add(dep);
            }
        }
        return failed;
    }

    private synchronized void transition(String stepId, StepStatus from, StepStatus to) {
        StepStatus current = statuses.get(stepId);
        if (current != from) {
            throw new IllegalStateException("Step " + stepId + " is " + current
                    + ", cannot move " + from + " -> " + to);
        }
        statuses.put(stepId, to);
        log.debug("Step {}: {} -> {}", stepId, from, to);
    }

    public synchronized StepStatus status(String stepId) {
        return statuses.get(stepId);
    }

    public synchronized Map<String, StepStatus> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public synchronized boolean isDone() {
        return statuses.values().stream().allMatch(StepStatus::isResolved);
    }

    public synchronized int batchCount() {
        return batchCount;
    }

    public synchronized Map<String, StepOutcome> outcomes() {
        var ordered = new LinkedHashMap<String, StepOutcome>();
        for (PlanStep step : plan.steps()) {
            StepOutcome outcome = outcomes.get(step.stepId());
            if (outcome != null) {
                ordered.put(step.stepId(), outcome);
            }
        }
        return Collections.unmodifiableMap(ordered);
    }
}
