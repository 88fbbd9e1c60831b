package io.github.sigwasm.core.code;

/**
 * A {@code return} out of the function, and so out of all enclosing blocks.
 */
public final class ReturnNode extends CodeNode {
    @Override
    public String toString() {
        return "return";
    }
}
