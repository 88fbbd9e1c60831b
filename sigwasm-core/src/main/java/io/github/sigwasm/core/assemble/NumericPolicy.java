package io.github.sigwasm.core.assemble;

/**
 * How the storage type of a signal is chosen.
 */
public enum NumericPolicy {
    /**
     * Every signal is stored in the WebAssembly type of its Java type.
     */
    EXACT,
    /**
     * {@code long} signals whose initial value fits in an {@code int} are stored as {@code i32}.
     * Reads sign-extend and writes wrap, so such signals lose their upper bits.
     */
    NARROW_I64,
}
