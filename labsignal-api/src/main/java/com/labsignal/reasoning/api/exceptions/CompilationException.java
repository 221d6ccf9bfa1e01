package com.labsignal.reasoning.api.exceptions;

/**
 * Thrown when the clinical catalog is malformed: a missing bound, a rule
 * without thresholds, a dangling reference and so on.
 *
 * <p>Unchecked so that it surfaces through startup and reload paths without
 * being caught and dropped along the way. A catalog that fails to compile
 * must never be served.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    public CompilationException(Throwable cause) {
        super(cause);
    }
}
