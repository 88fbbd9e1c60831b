package io.github.sigwasm.core;

/**
 * Thrown when lowered code does not keep the operand stack balanced.
 * <p>
 * This always indicates a bug in the compiler, rather than a problem with the input.
 */
public class StackImbalanceException extends CompilationException {
    public StackImbalanceException(String subject, String message) {
        super(subject, message);
    }
}
