package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a finding, ordered from most to least severe.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    /** Lower rank means more severe; used to sort report findings. */
    public int rank() {
        return ordinal();
    }

    public boolean isAtLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static Severity fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity is required");
        }
        return valueOf(value.trim().toUpperCase());
    }
}
