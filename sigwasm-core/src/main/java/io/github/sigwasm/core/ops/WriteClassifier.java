package io.github.sigwasm.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Gives every write the {@link WriteKind} of the value it stores.
 */
class WriteClassifier {
    private final List<SemanticOp> ops;

    WriteClassifier(List<SemanticOp> ops) {
        this.ops = ops;
    }

    WriteKind classify(SemanticOp write) {
        ValueRef value = write.inputs.get(1);
        if (value.isPhi()) {
            return isToggle(write.signalId, value) ? WriteKind.TOGGLE : WriteKind.COMPUTED;
        }
        SemanticOp producer = ops.get(value.single());
        switch (producer.kind) {
            case CONST:
                return WriteKind.SET;
            case ADD: {
                Number step = readPlusConstant(write.signalId, producer, true);
                if (step == null) return WriteKind.COMPUTED;
                if (step.doubleValue() == 1) return WriteKind.INCREMENT;
                if (step.doubleValue() == -1) return WriteKind.DECREMENT;
                return WriteKind.ADD;
            }
            case SUB: {
                Number step = readPlusConstant(write.signalId, producer, false);
                if (step == null) return WriteKind.COMPUTED;
                return step.doubleValue() == 1 ? WriteKind.DECREMENT : WriteKind.SUB;
            }
            case MUL:
                return readPlusConstant(write.signalId, producer, true) == null ? WriteKind.COMPUTED : WriteKind.MUL;
            default:
                return WriteKind.COMPUTED;
        }
    }

    /**
     * Match an arithmetic operation on a read of the signal and a constant.
     *
     * @param commutative Whether the constant may come first.
     * @return The constant, or null if the operation does not match.
     */
    @Nullable
    private Number readPlusConstant(long signal, SemanticOp op, boolean commutative) {
        SemanticOp left = single(op.inputs.get(0));
        SemanticOp right = single(op.inputs.get(1));
        if (left == null || right == null) return null;
        if (isRead(left, signal) && right.kind == SemanticOpKind.CONST) return right.constant;
        if (commutative && isRead(right, signal) && left.kind == SemanticOpKind.CONST) return left.constant;
        return null;
    }

    @Nullable
    private SemanticOp single(ValueRef ref) {
        return ref.isPhi() ? null : ops.get(ref.single());
    }

    private static boolean isRead(SemanticOp op, long signal) {
        return op.kind == SemanticOpKind.READ && op.signalId == signal;
    }

    /**
     * Match the ternary {@code s == 0 ? 1 : 0} and its equivalents, such as {@code !s} on a boolean.
     * <p>
     * The phi must join a constant on the fall-through path of a branch on the signal, which jumps over
     * the other constant, with a constant at the branch target.
     */
    private boolean isToggle(long signal, ValueRef value) {
        int[] producers = value.getProducers();
        if (producers.length != 2) return false;
        SemanticOp first = ops.get(producers[0]);
        SemanticOp second = ops.get(producers[1]);
        if (first.kind != SemanticOpKind.CONST || second.kind != SemanticOpKind.CONST) return false;

        for (int b = first.index - 1; b >= 0; b--) {
            SemanticOp branch = ops.get(b);
            if (branch.dead || branch.kind != SemanticOpKind.BRANCH) continue;
            int t = branch.target;
            if (t - 1 <= first.index || second.index < t) continue;
            SemanticOp jump = ops.get(t - 1);
            if (jump.kind != SemanticOpKind.JUMP || jump.target <= second.index) continue;

            Boolean at0 = taken(branch, signal, 0);
            Boolean at1 = taken(branch, signal, 1);
            if (at0 == null || at1 == null) return false;
            long value0 = (at0 ? second : first).constant.longValue();
            long value1 = (at1 ? second : first).constant.longValue();
            return value0 == 1 && value1 == 0;
        }
        return false;
    }

    /**
     * Evaluate a branch comparing the signal with a constant.
     *
     * @return Whether the branch is taken when the signal holds the value, or null if the branch
     * does not compare the signal with a constant.
     */
    @Nullable
    private Boolean taken(SemanticOp branch, long signal, long value) {
        List<ValueRef> operands = branch.compare >= 0 ? ops.get(branch.compare).inputs : branch.inputs;
        SemanticOp left = single(operands.get(0));
        if (left == null) return null;
        if (operands.size() == 1) {
            return isRead(left, signal) ? branch.comparison.test(value) : null;
        }
        SemanticOp right = single(operands.get(1));
        if (right == null) return null;
        if (isRead(left, signal) && right.kind == SemanticOpKind.CONST) {
            return branch.comparison.test(Double.compare(value, right.constant.doubleValue()));
        }
        if (isRead(right, signal) && left.kind == SemanticOpKind.CONST) {
            return branch.comparison.test(Double.compare(left.constant.doubleValue(), value));
        }
        return null;
    }
}
