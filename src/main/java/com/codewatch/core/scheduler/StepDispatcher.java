package com.codewatch.core.scheduler;

import com.codewatch.core.model.PlanStep;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Starts one step. The returned future must complete, normally or exceptionally;
 * the executor's barrier waits for it.
 */
@FunctionalInterface
public interface StepDispatcher {

    CompletableFuture<StepOutcome> dispatch(PlanStep step, Set<String> failedDependencies);
}
