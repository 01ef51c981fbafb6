package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution state of a plan step: {@code PENDING -> READY -> RUNNING -> COMPLETED | FAILED}.
 */
public enum StepStatus {
    PENDING,
    READY,
    RUNNING,
    COMPLETED,
    FAILED;

    /** A resolved step satisfies its dependents, whether it completed or failed. */
    public boolean isResolved() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
