package io.github.sigwasm.core.ops;

/**
 * The vocabulary of operations a handler may be made of.
 */
public enum SemanticOpKind {
    /**
     * Loads a captured getter or setter. Has no runtime representation.
     */
    ACCESSOR,
    /**
     * Reads a signal.
     */
    READ,
    /**
     * Writes a value to a signal.
     */
    WRITE,
    /**
     * Pushes a compile-time constant.
     */
    CONST,
    ADD,
    SUB,
    MUL,
    /**
     * Compares two longs, floats or doubles, for the branch that immediately follows.
     */
    COMPARE,
    /**
     * Conditionally jumps forward.
     */
    BRANCH,
    /**
     * Unconditionally jumps forward.
     */
    JUMP,
    RETURN,
    /**
     * Discards the value on top of the stack.
     */
    DISCARD,
    LOAD_LOCAL,
    STORE_LOCAL,
    /**
     * Converts between numeric types.
     */
    CONVERT,
    NOP,
}
