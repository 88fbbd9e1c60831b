package io.github.sigwasm.core.ops;

import io.github.sigwasm.core.ir.HandlerIR;
import io.github.sigwasm.core.wasm.ValType;

import java.util.*;

/**
 * A handler as a list of {@link SemanticOp}s, with the WebAssembly operand stack before each of them.
 * <p>
 * Stack heights and types count only values that exist at runtime: captured accessors on the JVM stack
 * have no counterpart in WebAssembly. A branch fused with a comparison sees the stack before the comparison.
 */
public final class HandlerOps {
    public final HandlerIR ir;
    private final List<SemanticOp> ops;
    private final ValType[][] stacks;
    private final List<Long> writtenSignals;

    public HandlerOps(HandlerIR ir, List<SemanticOp> ops, ValType[][] stacks, List<Long> writtenSignals) {
        this.ir = ir;
        this.ops = Collections.unmodifiableList(ops);
        this.stacks = stacks;
        this.writtenSignals = Collections.unmodifiableList(writtenSignals);
    }

    public List<SemanticOp> getOps() {
        return ops;
    }

    public SemanticOp get(int index) {
        return ops.get(index);
    }

    public int size() {
        return ops.size();
    }

    /**
     * Get the operand stack before an operation.
     *
     * @param index The index of the operation.
     * @return The types on the stack, bottom first, or null if the operation is dead.
     */
    public ValType[] stackAt(int index) {
        return stacks[index];
    }

    /**
     * Get the stack height before an operation.
     *
     * @param index The index of the operation.
     * @return The height, or -1 if the operation is dead.
     */
    public int height(int index) {
        return stacks[index] == null ? -1 : stacks[index].length;
    }

    /**
     * Get the stack height after a branch has popped its operands.
     *
     * @param index The index of the branch.
     * @return The height.
     */
    public int heightAfterBranch(int index) {
        SemanticOp op = ops.get(index);
        return height(index) - op.inputs.size() - (op.compare >= 0 ? 1 : 0);
    }

    /**
     * Get the signals this handler writes, in order of their first write.
     *
     * @return The signal ids.
     */
    public List<Long> getWrittenSignals() {
        return writtenSignals;
    }

    /**
     * Get the shapes of all writes to a signal.
     *
     * @param signalId The signal.
     * @return The kinds of the writes, in order.
     */
    public List<WriteKind> getWriteKinds(long signalId) {
        List<WriteKind> kinds = new ArrayList<>();
        for (SemanticOp op : ops) {
            if (op.kind == SemanticOpKind.WRITE && op.signalId == signalId) {
                kinds.add(op.writeKind);
            }
        }
        return kinds;
    }

    /**
     * Get all live branches and jumps.
     *
     * @return The operations.
     */
    public List<SemanticOp> getJumps() {
        List<SemanticOp> jumps = new ArrayList<>();
        for (SemanticOp op : ops) {
            if (!op.dead && op.isJump()) jumps.add(op);
        }
        return jumps;
    }

    /**
     * Find the last live operation in a range.
     *
     * @param from The first index, inclusive.
     * @param to   The last index, exclusive.
     * @return The operation, or null if there is none.
     */
    public SemanticOp lastLive(int from, int to) {
        for (int i = to - 1; i >= from; i--) {
            if (!ops.get(i).dead) return ops.get(i);
        }
        return null;
    }

    public String subject() {
        return ir.subject();
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner("\n");
        for (SemanticOp op : ops) {
            sj.add(op + "  ; " + (stacks[op.index] == null ? "-" : Arrays.toString(stacks[op.index])));
        }
        return sj.toString();
    }
}
