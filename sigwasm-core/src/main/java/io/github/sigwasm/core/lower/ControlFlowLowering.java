package io.github.sigwasm.core.lower;

import io.github.sigwasm.core.UnsupportedOpException;
import io.github.sigwasm.core.code.*;
import io.github.sigwasm.core.ops.Comparison;
import io.github.sigwasm.core.ops.HandlerOps;
import io.github.sigwasm.core.ops.SemanticOp;
import io.github.sigwasm.core.ops.SemanticOpKind;
import io.github.sigwasm.core.passes.IRPass;
import io.github.sigwasm.core.wasm.FuncType;
import io.github.sigwasm.core.wasm.Opcodes;
import io.github.sigwasm.core.wasm.ValType;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Lowers the forward jumps of a handler into structured WebAssembly blocks.
 * <p>
 * Each conditional branch is lowered, in order of preference, as:
 * <ol>
 *     <li>an {@code if} over the code it skips, when that code is self-contained;</li>
 *     <li>an {@code if ... else}, when the skipped code ends by jumping over the code after it;</li>
 *     <li>a {@code br_if} to an enclosing block ending at its target;</li>
 *     <li>a nest of {@code block}s, one per target, spanning every jump reachable from the branch,
 *     which is how short-circuit conditions are lowered.</li>
 * </ol>
 * Regions are lowered recursively by the same rules, so every block leaves exactly its declared result,
 * and code after a region is only visited once the region is done. Returns exit the function from any depth.
 */
public class ControlFlowLowering implements IRPass<HandlerOps, FunctionBody> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlowLowering.class);

    private final LoweringTarget target;

    public ControlFlowLowering(LoweringTarget target) {
        this.target = target;
    }

    @Override
    public FunctionBody run(HandlerOps ops) {
        FunctionBody fn = new FunctionBody(FuncType.VOID);
        Lowering lowering = new Lowering(ops, fn);
        lowering.lowerRange(0, ops.size(), fn.body, LabelScope.EMPTY, 0, true, Collections.<Integer>emptySet());
        LOGGER.debug("{} lowered to {} top-level nodes with {} locals", ops.subject(), fn.body.size(), fn.locals.size());
        return new StackVerifier(ops.subject()).run(fn);
    }

    /**
     * Where the blocks of a short-circuit nest end, while their contents are being lowered.
     */
    private static final class LabelMarker extends CodeNode {
        final int position;

        LabelMarker(int position) {
            this.position = position;
        }

        @Override
        public String toString() {
            return "@" + position;
        }
    }

    private class Lowering {
        final HandlerOps ops;
        final FunctionBody fn;
        final Map<String, Integer> locals = new HashMap<>();
        final int lastLive;

        Lowering(HandlerOps ops, FunctionBody fn) {
            this.ops = ops;
            this.fn = fn;
            SemanticOp last = ops.lastLive(0, ops.size());
            this.lastLive = last == null ? -1 : last.index;
        }

        UnsupportedOpException unsupported(SemanticOp op, String message) {
            return new UnsupportedOpException(ops.subject(), op.index,
                    (op.line >= 0 ? "line " + op.line + ": " : "") + message);
        }

        /**
         * Lower the operations in {@code [from, to)}.
         *
         * @param out       The code to append to.
         * @param scope     The labels that may be branched to.
         * @param frameBase The stack height at the start of the innermost enclosing block.
         * @param topLevel  Whether {@code out} is the function body itself.
         * @param markers   Positions at which to place a {@link LabelMarker}.
         */
        void lowerRange(int from, int to, List<CodeNode> out, LabelScope scope,
                        int frameBase, boolean topLevel, Set<Integer> markers) {
            Map<Integer, Integer> marks = new HashMap<>();
            int i = from;
            while (i < to) {
                if (markers.contains(i)) out.add(new LabelMarker(i));
                SemanticOp op = ops.get(i);
                if (op.dead) {
                    i++;
                    continue;
                }
                marks.put(i, out.size());
                if (op.kind == SemanticOpKind.BRANCH) {
                    i = lowerBranch(op, to, out, scope, frameBase, marks);
                } else {
                    lowerOp(op, out, scope, frameBase, topLevel);
                    i++;
                }
            }
            if (markers.contains(to)) out.add(new LabelMarker(to));
        }

        void lowerOp(SemanticOp op, List<CodeNode> out, LabelScope scope, int frameBase, boolean topLevel) {
            switch (op.kind) {
                case ACCESSOR:
                case COMPARE:
                case NOP:
                    return;
                case READ:
                    target.emitRead(op.signalId, out);
                    return;
                case WRITE:
                    target.emitWrite(op.signalId, out);
                    return;
                case CONST:
                    out.add(Insns.constant(op.type, op.constant));
                    return;
                case ADD:
                    out.add(Insns.op(arithmetic(op.type, Opcodes.I32_ADD, Opcodes.I64_ADD, Opcodes.F32_ADD, Opcodes.F64_ADD)));
                    return;
                case SUB:
                    out.add(Insns.op(arithmetic(op.type, Opcodes.I32_SUB, Opcodes.I64_SUB, Opcodes.F32_SUB, Opcodes.F64_SUB)));
                    return;
                case MUL:
                    out.add(Insns.op(arithmetic(op.type, Opcodes.I32_MUL, Opcodes.I64_MUL, Opcodes.F32_MUL, Opcodes.F64_MUL)));
                    return;
                case CONVERT:
                    convert(op, out);
                    return;
                case DISCARD:
                    if (op.type != null) out.add(Insns.drop(op.type));
                    return;
                case LOAD_LOCAL:
                    out.add(Insns.localGet(local(op), op.type));
                    return;
                case STORE_LOCAL:
                    out.add(Insns.localSet(local(op), op.type));
                    return;
                case RETURN:
                    target.emitEpilogue(ops, out);
                    if (!topLevel || op.index != lastLive) out.add(new ReturnNode());
                    return;
                case JUMP: {
                    LabelScope.Label label = scope.find(op.target);
                    if (label == null) {
                        throw unsupported(op, "goto " + op.target + " leaves no structured block to exit");
                    }
                    out.add(branchTo(op, label, ops.height(op.index), frameBase, false));
                    return;
                }
                default:
                    throw unsupported(op, "cannot lower " + op.kind);
            }
        }

        int local(SemanticOp op) {
            String key = op.local + ":" + op.type;
            Integer index = locals.get(key);
            if (index == null) {
                index = fn.addLocal(op.type);
                locals.put(key, index);
            }
            return index;
        }

        int arithmetic(ValType type, int i32, int i64, int f32, int f64) {
            switch (type) {
                case I32:
                    return i32;
                case I64:
                    return i64;
                case F32:
                    return f32;
                default:
                    return f64;
            }
        }

        void convert(SemanticOp op, List<CodeNode> out) {
            switch (op.opcode()) {
                case org.objectweb.asm.Opcodes.I2L:
                    out.add(Insns.op(Opcodes.I64_EXTEND_I32_S));
                    break;
                case org.objectweb.asm.Opcodes.I2F:
                    out.add(Insns.op(Opcodes.F32_CONVERT_I32_S));
                    break;
                case org.objectweb.asm.Opcodes.I2D:
                    out.add(Insns.op(Opcodes.F64_CONVERT_I32_S));
                    break;
                case org.objectweb.asm.Opcodes.L2I:
                    out.add(Insns.op(Opcodes.I32_WRAP_I64));
                    break;
                case org.objectweb.asm.Opcodes.L2F:
                    out.add(Insns.op(Opcodes.F32_CONVERT_I64_S));
                    break;
                case org.objectweb.asm.Opcodes.L2D:
                    out.add(Insns.op(Opcodes.F64_CONVERT_I64_S));
                    break;
                case org.objectweb.asm.Opcodes.F2I:
                    out.add(Insns.op(Opcodes.I32_TRUNC_SAT_F32_S));
                    break;
                case org.objectweb.asm.Opcodes.F2L:
                    out.add(Insns.op(Opcodes.I64_TRUNC_SAT_F32_S));
                    break;
                case org.objectweb.asm.Opcodes.F2D:
                    out.add(Insns.op(Opcodes.F64_PROMOTE_F32));
                    break;
                case org.objectweb.asm.Opcodes.D2I:
                    out.add(Insns.op(Opcodes.I32_TRUNC_SAT_F64_S));
                    break;
                case org.objectweb.asm.Opcodes.D2L:
                    out.add(Insns.op(Opcodes.I64_TRUNC_SAT_F64_S));
                    break;
                case org.objectweb.asm.Opcodes.D2F:
                    out.add(Insns.op(Opcodes.F32_DEMOTE_F64));
                    break;
                case org.objectweb.asm.Opcodes.I2B:
                    out.add(Insns.op(Opcodes.I32_EXTEND8_S));
                    break;
                case org.objectweb.asm.Opcodes.I2S:
                    out.add(Insns.op(Opcodes.I32_EXTEND16_S));
                    break;
                case org.objectweb.asm.Opcodes.I2C:
                    out.add(Insns.i32Const(0xFFFF));
                    out.add(Insns.op(Opcodes.I32_AND));
                    break;
                default:
                    throw unsupported(op, "cannot convert with " + op.mnemonic());
            }
        }

        BranchNode branchTo(SemanticOp op, LabelScope.Label label, int height, int frameBase, boolean conditional) {
            int arity = label.block.result == null ? 0 : 1;
            if (height != label.base + arity) {
                throw unsupported(op, "jump to " + label.position + " with " + (height - label.base)
                        + " values on the stack, but the block ending there takes " + arity);
            }
            if (arity > 0 && label.base < frameBase) {
                throw unsupported(op, "jump to " + label.position + " carries a value from outside its block");
            }
            label.used = true;
            return new BranchNode(conditional, label.block);
        }

        /**
         * Lower a conditional branch and everything it controls.
         *
         * @return The index to continue lowering from.
         */
        int lowerBranch(SemanticOp op, int to, List<CodeNode> out, LabelScope scope,
                        int frameBase, Map<Integer, Integer> marks) {
            int i = op.index;
            int t = op.target;
            int base = ops.heightAfterBranch(i);

            if (t <= to) {
                if (isPlainIf(i, t, scope, base)) {
                    emitCondition(op, false, out);
                    BlockNode block = BlockNode.ifBlock(null);
                    out.add(block);
                    lowerRange(i + 1, t, block.body, scope.filter(t).push(t, block, base),
                            base, false, Collections.<Integer>emptySet());
                    return t;
                }
                SemanticOp jump = ops.lastLive(i + 1, t);
                int u = ifElseEnd(i, t, to, jump, scope, base);
                if (u >= 0) {
                    ValType result = ops.height(u) > base ? top(u) : null;
                    emitCondition(op, false, out);
                    BlockNode block = BlockNode.ifBlock(result);
                    out.add(block);
                    LabelScope inner = scope.filter(u).push(u, block, base);
                    lowerRange(i + 1, jump.index, block.body, inner, base, false, Collections.<Integer>emptySet());
                    lowerRange(t, u, block.addElse(), inner, base, false, Collections.<Integer>emptySet());
                    return u;
                }
            }

            LabelScope.Label label = scope.find(t);
            if (label != null) {
                emitCondition(op, true, out);
                out.add(branchTo(op, label, base, frameBase, true));
                return i + 1;
            }

            return lowerExtent(op, to, out, scope, frameBase, marks);
        }

        boolean isPlainIf(int i, int t, LabelScope scope, int base) {
            if (ops.height(t) != base) return false;
            SemanticOp last = ops.lastLive(i + 1, t);
            if (last != null && last.kind == SemanticOpKind.JUMP && last.target != t) return false;
            return jumpsStayWithin(i + 1, t, t, t, scope) && !jumpsInto(i, t);
        }

        /**
         * Check for an if-else: the skipped code ends with a jump over the code that follows it.
         *
         * @return The end of the else part, or -1 if the branch is not an if-else.
         */
        int ifElseEnd(int i, int t, int to, @Nullable SemanticOp jump, LabelScope scope, int base) {
            if (jump == null || jump.kind != SemanticOpKind.JUMP) return -1;
            int u = jump.target;
            if (u <= t || u > to) return -1;
            int arity = ops.height(u) - base;
            if (arity != 0 && arity != 1) return -1;
            if (!jumpsStayWithin(i + 1, jump.index, jump.index, u, scope)) return -1;
            if (!jumpsStayWithin(t, u, u, u, scope)) return -1;
            return jumpsInto(i, u) ? -1 : u;
        }

        /**
         * Check that every jump in {@code [from, to)} goes no further than {@code limit},
         * or goes to {@code exit}, or to a visible label.
         */
        boolean jumpsStayWithin(int from, int to, int limit, int exit, LabelScope scope) {
            for (int k = from; k < to; k++) {
                SemanticOp jump = ops.get(k);
                if (jump.dead || !jump.isJump()) continue;
                if (jump.target > limit && jump.target != exit && scope.find(jump.target) == null) return false;
            }
            return true;
        }

        /**
         * Check whether any jump before {@code i} lands strictly inside {@code (i, end)}.
         */
        boolean jumpsInto(int i, int end) {
            for (int k = 0; k < i; k++) {
                SemanticOp jump = ops.get(k);
                if (jump.dead || !jump.isJump()) continue;
                if (jump.target > i && jump.target < end) return true;
            }
            return false;
        }

        ValType top(int position) {
            ValType[] stack = ops.stackAt(position);
            return stack[stack.length - 1];
        }

        /**
         * Lower a branch as a nest of blocks spanning every jump reachable from it.
         * <p>
         * The nest starts at the latest operation at which the stack is as it will be after the branch,
         * so that the code computing the condition moves inside the blocks with it.
         */
        int lowerExtent(SemanticOp op, int to, List<CodeNode> out, LabelScope scope,
                        int frameBase, Map<Integer, Integer> marks) {
            int i = op.index;
            int base = ops.heightAfterBranch(i);

            int p = -1;
            for (int k : marks.keySet()) {
                if (k <= i && k > p && ops.height(k) == base) p = k;
            }
            if (p < 0) {
                throw unsupported(op, "cannot structure branch to " + op.target
                        + ": its condition is not computed on a stack of height " + base);
            }

            int x = op.target;
            boolean changed = true;
            while (changed) {
                changed = false;
                for (int k = i + 1; k < x; k++) {
                    SemanticOp jump = ops.get(k);
                    if (jump.dead || !jump.isJump()) continue;
                    if (jump.target > x && scope.find(jump.target) == null) {
                        x = jump.target;
                        changed = true;
                    }
                }
            }
            if (x > to) {
                throw unsupported(op, "branch to " + op.target + " reaches " + x
                        + ", past the end of its enclosing region at " + to);
            }

            TreeMap<Integer, LabelScope.Label> pending = new TreeMap<>();
            for (int k = i; k < x; k++) {
                SemanticOp jump = ops.get(k);
                if (jump.dead || !jump.isJump() || jump.target > x || pending.containsKey(jump.target)) continue;
                int arity = ops.height(jump.target) - base;
                if (arity != 0 && arity != 1) {
                    throw unsupported(jump, "jump to " + jump.target + " carries " + arity + " values");
                }
                BlockNode block = BlockNode.block(arity == 1 ? top(jump.target) : null);
                pending.put(jump.target, new LabelScope.Label(jump.target, block, base));
            }

            int nestStart = p;
            List<CodeNode> tail = out.subList(marks.get(nestStart), out.size());
            List<CodeNode> scan = new ArrayList<>(tail);
            tail.clear();
            marks.keySet().removeIf(k -> k > nestStart);
            for (CodeNode node : scan) {
                if (node instanceof LabelMarker) {
                    throw unsupported(op, "condition of branch to " + op.target
                            + " overlaps the end of block " + ((LabelMarker) node).position);
                }
            }

            LabelScope inner = scope.filter(x);
            for (LabelScope.Label label : pending.values()) {
                inner = inner.push(label);
            }
            emitCondition(op, true, scan);
            scan.add(branchTo(op, pending.get(op.target), base, base, true));
            lowerRange(i + 1, x, scan, inner, base, false, pending.keySet());

            List<CodeNode> acc = new ArrayList<>();
            for (CodeNode node : scan) {
                if (node instanceof LabelMarker) {
                    LabelScope.Label label = pending.get(((LabelMarker) node).position);
                    label.placed = true;
                    if (label.used) {
                        label.block.body.addAll(acc);
                        acc = new ArrayList<>();
                        acc.add(label.block);
                    }
                } else {
                    acc.add(node);
                }
            }
            for (LabelScope.Label label : pending.values()) {
                if (label.used && !label.placed) {
                    throw unsupported(op, "jump target " + label.position
                            + " lies inside a nested region and cannot be reached with a block");
                }
            }
            out.addAll(acc);
            return x;
        }

        /**
         * Emit the condition of a branch, consuming its operands.
         *
         * @param jump Whether to leave 1 when the branch is taken, or when it falls through.
         */
        void emitCondition(SemanticOp op, boolean jump, List<CodeNode> out) {
            Comparison cmp = jump ? op.comparison : op.comparison.negate();
            if (op.compare >= 0) {
                SemanticOp compare = ops.get(op.compare);
                if (compare.type == ValType.I64) {
                    out.add(Insns.op(relation(ValType.I64, cmp)));
                } else {
                    floatCondition(compare, op.comparison, jump, out);
                }
                return;
            }
            if (op.inputs.size() == 2) {
                out.add(Insns.op(relation(ValType.I32, cmp)));
                return;
            }
            switch (cmp) {
                case EQ:
                    out.add(Insns.op(Opcodes.I32_EQZ));
                    break;
                case NE:
                    break;
                default:
                    out.add(Insns.i32Const(0));
                    out.add(Insns.op(relation(ValType.I32, cmp)));
            }
        }

        /**
         * Emit a float comparison, where NaN makes {@code fcmpl} yield -1 and {@code fcmpg} yield 1.
         */
        void floatCondition(SemanticOp compare, Comparison cmp, boolean jump, List<CodeNode> out) {
            int opcode = compare.opcode();
            boolean nanIsLess = opcode == org.objectweb.asm.Opcodes.FCMPL
                    || opcode == org.objectweb.asm.Opcodes.DCMPL;
            Comparison relation;
            boolean invert;
            switch (cmp) {
                case LT:
                    relation = nanIsLess ? Comparison.GE : Comparison.LT;
                    invert = nanIsLess;
                    break;
                case GE:
                    relation = nanIsLess ? Comparison.GE : Comparison.LT;
                    invert = !nanIsLess;
                    break;
                case GT:
                    relation = nanIsLess ? Comparison.GT : Comparison.LE;
                    invert = !nanIsLess;
                    break;
                case LE:
                    relation = nanIsLess ? Comparison.GT : Comparison.LE;
                    invert = nanIsLess;
                    break;
                default:
                    relation = cmp;
                    invert = false;
            }
            out.add(Insns.op(relation(compare.type, relation)));
            if (invert == jump) out.add(Insns.op(Opcodes.I32_EQZ));
        }

        int relation(ValType type, Comparison cmp) {
            switch (type) {
                case I32:
                    return pick(cmp, Opcodes.I32_EQ, Opcodes.I32_NE, Opcodes.I32_LT_S,
                            Opcodes.I32_GE_S, Opcodes.I32_GT_S, Opcodes.I32_LE_S);
                case I64:
                    return pick(cmp, Opcodes.I64_EQ, Opcodes.I64_NE, Opcodes.I64_LT_S,
                            Opcodes.I64_GE_S, Opcodes.I64_GT_S, Opcodes.I64_LE_S);
                case F32:
                    return pick(cmp, Opcodes.F32_EQ, Opcodes.F32_NE, Opcodes.F32_LT,
                            Opcodes.F32_GE, Opcodes.F32_GT, Opcodes.F32_LE);
                default:
                    return pick(cmp, Opcodes.F64_EQ, Opcodes.F64_NE, Opcodes.F64_LT,
                            Opcodes.F64_GE, Opcodes.F64_GT, Opcodes.F64_LE);
            }
        }

        int pick(Comparison cmp, int eq, int ne, int lt, int ge, int gt, int le) {
            switch (cmp) {
                case EQ:
                    return eq;
                case NE:
                    return ne;
                case LT:
                    return lt;
                case GE:
                    return ge;
                case GT:
                    return gt;
                default:
                    return le;
            }
        }
    }
}
