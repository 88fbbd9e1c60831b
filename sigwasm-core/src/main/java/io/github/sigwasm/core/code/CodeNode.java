package io.github.sigwasm.core.code;

/**
 * A node in the tree of a function body being generated.
 * <p>
 * Bodies are kept as trees of structured blocks until they are encoded by {@link CodeWriter},
 * so that {@link StackVerifier} can check each block's stack effect on its own.
 */
public abstract class CodeNode {
    protected CodeNode() {
    }
}
