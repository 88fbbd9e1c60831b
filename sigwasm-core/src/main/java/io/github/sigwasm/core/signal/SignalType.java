package io.github.sigwasm.core.signal;

/**
 * The declared type of a signal's value.
 */
public enum SignalType {
    /**
     * A 32-bit integer.
     */
    I32("I"),
    /**
     * A 64-bit integer.
     */
    I64("J"),
    /**
     * A 32-bit float.
     */
    F32("F"),
    /**
     * A 64-bit float.
     */
    F64("D"),
    /**
     * A boolean, stored as 0 or 1.
     */
    BOOL("Z"),
    ;

    private final String descriptor;

    SignalType(String descriptor) {
        this.descriptor = descriptor;
    }

    /**
     * Get the JVM type descriptor of the values of this type, as seen by getters and setters.
     *
     * @return The descriptor.
     */
    public String getDescriptor() {
        return descriptor;
    }
}
