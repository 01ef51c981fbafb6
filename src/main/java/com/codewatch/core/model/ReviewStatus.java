package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a review. The final report always carries one of
 * {@link #COMPLETED}, {@link #PARTIAL} or {@link #FAILED}.
 */
public enum ReviewStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
