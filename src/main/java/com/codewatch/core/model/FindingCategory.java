package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categories of review findings.
 */
public enum FindingCategory {
    SECURITY,
    BUG,
    STYLE,
    PERFORMANCE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
