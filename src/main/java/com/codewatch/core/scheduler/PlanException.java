package com.codewatch.core.scheduler;

import com.codewatch.core.CodewatchException;

/**
 * A plan that cannot be executed. Raised while the plan is built or validated,
 * never during execution.
 */
public class PlanException extends CodewatchException {

    public enum Reason {
        EMPTY_PLAN,
        DUPLICATE_STEP,
        UNKNOWN_DEPENDENCY,
        UNKNOWN_CAPABILITY,
        CYCLE
    }

    private final Reason reason;

    public PlanException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
