package io.github.sigwasm.core;

/**
 * Thrown when a handler refers to a signal that was not created during the analysis of its component.
 */
public class UnknownSignalException extends CompilationException {
    public UnknownSignalException(String subject, String message) {
        super(subject, message);
    }
}
