package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verification state of a proposed fix. {@link #PENDING} moves to one of the other two
 * exactly once.
 */
public enum VerificationStatus {
    PENDING,
    VERIFIED,
    UNVERIFIED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
