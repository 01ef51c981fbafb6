package com.codewatch.core.capability;

import com.codewatch.core.CodewatchException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Failure of a capability invocation. The {@link ErrorKind} decides whether the
 * retry supervisor tries again.
 */
public class CapabilityException extends CodewatchException {

    private final ErrorKind kind;

    public CapabilityException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CapabilityException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isRecoverable() {
        return kind.isRecoverable();
    }

    public static CapabilityException timeout(String message) {
        return new CapabilityException(ErrorKind.TIMEOUT, message);
    }

    public static CapabilityException rateLimited(String message) {
        return new CapabilityException(ErrorKind.RATE_LIMITED, message);
    }

    public static CapabilityException transientIo(String message, Throwable cause) {
        return new CapabilityException(ErrorKind.TRANSIENT_IO, message, cause);
    }

    public static CapabilityException malformedInput(String message) {
        return new CapabilityException(ErrorKind.MALFORMED_INPUT, message);
    }

    public static CapabilityException schemaViolation(String message) {
        return new CapabilityException(ErrorKind.SCHEMA_VIOLATION, message);
    }

    /**
     * Maps an arbitrary throwable from a capability onto the error taxonomy.
     */
    public static CapabilityException classify(Throwable error) {
        if (error instanceof CapabilityException ce) {
            return ce;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (error instanceof TimeoutException) {
            return new CapabilityException(ErrorKind.TIMEOUT, message, error);
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return new CapabilityException(ErrorKind.TRANSIENT_IO, message, error);
        }
        if (error instanceof IllegalArgumentException) {
            return new CapabilityException(ErrorKind.MALFORMED_INPUT, message, error);
        }
        return new CapabilityException(ErrorKind.INTERNAL, message, error);
    }
}
