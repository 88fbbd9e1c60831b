package io.github.sigwasm.core.ops;

/**
 * The shape of the value written to a signal.
 */
public enum WriteKind {
    /**
     * The signal plus one.
     */
    INCREMENT,
    /**
     * The signal minus one.
     */
    DECREMENT,
    /**
     * The signal plus a constant.
     */
    ADD,
    /**
     * The signal minus a constant.
     */
    SUB,
    /**
     * The signal times a constant.
     */
    MUL,
    /**
     * A constant.
     */
    SET,
    /**
     * 1 if the signal is 0, and 0 if it is 1.
     */
    TOGGLE,
    /**
     * Anything else.
     */
    COMPUTED,
}
