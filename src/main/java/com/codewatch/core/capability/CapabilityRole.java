package com.codewatch.core.capability;

/**
 * Where a capability sits in a generated plan.
 */
public enum CapabilityRole {
    /** Runs on the submitted source; analysis steps fan out in parallel. */
    ANALYSIS,
    /** Runs after analysis on the consolidated findings and fixes. */
    VERIFICATION
}
