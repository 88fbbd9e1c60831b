package io.github.sigwasm.core;

/**
 * Thrown when a handler contains an instruction that cannot be compiled.
 */
public class UnsupportedOpException extends CompilationException {
    private final int insnIndex;

    public UnsupportedOpException(String subject, int insnIndex, String message) {
        super(subject, "instruction " + insnIndex + ": " + message);
        this.insnIndex = insnIndex;
    }

    /**
     * Get the index of the offending instruction among the real instructions of the handler.
     *
     * @return The index.
     */
    public int getInsnIndex() {
        return insnIndex;
    }
}
