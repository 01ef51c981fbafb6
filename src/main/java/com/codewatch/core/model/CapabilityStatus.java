package com.codewatch.core.model;

/**
 * Status a capability reports alongside its result.
 */
public enum CapabilityStatus {
    COMPLETED,
    FAILED
}
