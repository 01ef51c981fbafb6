package com.codewatch.core.scheduler;

import com.codewatch.core.model.PlanStep;
import com.codewatch.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes the next batch of steps eligible for dispatch.
 * <p>
 * A step is ready when it is pending and every dependency has resolved, completed or
 * failed. When parallel steps are ready they all form the batch; otherwise the first
 * ready sequential step in plan order runs alone.
 */
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    /**
     * @param steps       all steps in plan order
     * @param statuses    current status of every step
     * @param batchNumber number to give the batch
     * @return the next batch; empty if nothing is ready
     */
    public Batch nextBatch(List<PlanStep> steps, Map<String, StepStatus> statuses, int batchNumber) {
        var parallel = new ArrayList<PlanStep>();
        PlanStep firstSequential = null;

        for (PlanStep step : steps) {
            if (statuses.get(step.stepId()) != StepStatus.PENDING) {
                continue;
            }
            if (!allDependenciesResolved(step, statuses)) {
                log.debug("  {} [{}] waiting on {}", step.stepId(), step.capabilityId(), step.dependencies());
                continue;
            }
            if (step.parallel()) {
                parallel.add(step);
            } else if (firstSequential == null) {
                firstSequential = step;
            }
        }

        Batch batch;
        if (!parallel.isEmpty()) {
            batch = new Batch(batchNumber, parallel, true);
        } else if (firstSequential != null) {
            batch = new Batch(batchNumber, List.of(firstSequential), false);
        } else {
            batch = new Batch(batchNumber, List.of(), false);
        }
        log.debug("nextBatch #{}: {} (parallel={})", batchNumber, batch.stepIds(), batch.parallel());
        return batch;
    }

    private boolean allDependenciesResolved(PlanStep step, Map<String, StepStatus> statuses) {
        for (String dep : step.dependencies()) {
            StepStatus status = statuses.get(dep);
            if (status == null || !status.isResolved()) {
                return false;
            }
        }
        return true;
    }
}
