package com.codewatch.core.capability;

/**
 * Classification of capability failures. Only recoverable kinds are retried.
 */
public enum ErrorKind {
    TIMEOUT(true),
    RATE_LIMITED(true),
    TRANSIENT_IO(true),
    MALFORMED_INPUT(false),
    SCHEMA_VIOLATION(false),
    REPORTED_FAILURE(false),
    INTERNAL(false);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
