package com.codewatch.core;

/**
 * Root of the Codewatch exception hierarchy.
 */
public class CodewatchException extends RuntimeException {
    public CodewatchException(String message) {
        super(message);
    }

    public CodewatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
