package io.github.sigwasm.core;

/**
 * Thrown when the bytecode of a handler cannot be recovered,
 * or when it captures something other than signal accessors and constants.
 */
public class IRExtractionException extends CompilationException {
    public IRExtractionException(String subject, String message) {
        super(subject, message);
    }

    public IRExtractionException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
    }
}
