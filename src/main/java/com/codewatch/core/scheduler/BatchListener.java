package com.codewatch.core.scheduler;

import java.util.List;

/**
 * Called at each barrier, on the executing thread, after every step in the batch resolved
 * and before the next batch is scheduled.
 */
@FunctionalInterface
public interface BatchListener {

    void onBatchResolved(Batch batch, List<StepOutcome> outcomes);
}
