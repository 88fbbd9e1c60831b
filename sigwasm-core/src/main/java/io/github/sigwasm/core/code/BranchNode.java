package io.github.sigwasm.core.code;

/**
 * A {@code br} or {@code br_if} out of an enclosing block.
 */
public final class BranchNode extends CodeNode {
    public final boolean conditional;
    public final BlockNode target;

    public BranchNode(boolean conditional, BlockNode target) {
        this.conditional = conditional;
        this.target = target;
    }

    @Override
    public String toString() {
        return (conditional ? "br_if " : "br ") + target;
    }
}
