package io.github.sigwasm.core.ops;

import io.github.sigwasm.core.UnsupportedOpException;
import io.github.sigwasm.core.ir.CapturedValue;
import io.github.sigwasm.core.ir.HandlerIR;
import io.github.sigwasm.core.passes.IRPass;
import io.github.sigwasm.core.signal.*;
import io.github.sigwasm.core.wasm.ValType;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.*;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;
import org.objectweb.asm.tree.analysis.SourceValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static org.objectweb.asm.Opcodes.*;

/**
 * Classifies the instructions of a handler into {@link SemanticOp}s.
 * <p>
 * The first pass finds loads of captured accessors, and the getter and setter calls made through them.
 * The second pass classifies everything else, rejecting any instruction outside the vocabulary with an
 * {@link UnsupportedOpException}. Finally every write is given a {@link WriteKind}.
 */
public class SemanticExtractor implements IRPass<HandlerIR, HandlerOps> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticExtractor.class);

    public static final SemanticExtractor INSTANCE = new SemanticExtractor();

    private static final Map<String, Type> GETTERS = new HashMap<>();
    private static final Map<String, Type> SETTERS = new HashMap<>();

    private static void accessors(Class<?> getter, Class<?> setter, Type type) {
        GETTERS.put(Type.getInternalName(getter), type);
        SETTERS.put(Type.getInternalName(setter), type);
    }

    static {
        accessors(IntSignal.Getter.class, IntSignal.Setter.class, Type.INT_TYPE);
        accessors(LongSignal.Getter.class, LongSignal.Setter.class, Type.LONG_TYPE);
        accessors(FloatSignal.Getter.class, FloatSignal.Setter.class, Type.FLOAT_TYPE);
        accessors(DoubleSignal.Getter.class, DoubleSignal.Setter.class, Type.DOUBLE_TYPE);
        accessors(BoolSignal.Getter.class, BoolSignal.Setter.class, Type.BOOLEAN_TYPE);
    }

    @Override
    public HandlerOps run(HandlerIR ir) {
        return new Extraction(ir).extract();
    }

    private static class Extraction {
        final HandlerIR ir;
        final String subject;
        final List<SemanticOp> ops = new ArrayList<>();
        final List<Integer> insnIndices = new ArrayList<>();
        final Map<AbstractInsnNode, Integer> opIndices = new IdentityHashMap<>();
        ValType[][] stacks;

        Extraction(HandlerIR ir) {
            this.ir = ir;
            this.subject = ir.subject();
        }

        HandlerOps extract() {
            collect();
            int n = ops.size();
            stacks = new ValType[n + 1][];
            stacks[n] = new ValType[0];
            for (SemanticOp op : ops) {
                Frame<BasicValue> frame = typeFrame(op);
                if (frame == null) {
                    op.dead = true;
                } else {
                    stacks[op.index] = wasmStack(frame);
                }
            }

            for (SemanticOp op : ops) {
                if (!op.dead && op.opcode() == ALOAD) loadAccessor(op);
            }
            for (SemanticOp op : ops) {
                if (!op.dead && op.insn instanceof MethodInsnNode) invoke(op);
            }
            for (SemanticOp op : ops) {
                if (!op.dead && op.kind == SemanticOpKind.NOP) classify(op);
            }
            for (SemanticOp op : ops) {
                if (!op.dead && op.kind == SemanticOpKind.COMPARE && !isFused(op)) {
                    throw unsupported(op, "the result of " + op.mnemonic() + " must be tested by the next instruction");
                }
            }

            List<Long> written = new ArrayList<>();
            for (SemanticOp op : ops) {
                if (op.dead || op.kind != SemanticOpKind.WRITE) continue;
                op.writeKind = new WriteClassifier(ops).classify(op);
                if (!written.contains(op.signalId)) written.add(op.signalId);
            }

            HandlerOps handlerOps = new HandlerOps(ir, ops, stacks, written);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{} semantic operations:\n{}", subject, handlerOps);
            }
            return handlerOps;
        }

        private void collect() {
            InsnList insns = ir.method.instructions;
            int line = -1;
            int i = 0;
            for (AbstractInsnNode insn = insns.getFirst(); insn != null; insn = insn.getNext(), i++) {
                if (insn instanceof LineNumberNode) {
                    line = ((LineNumberNode) insn).line;
                } else if (insn.getOpcode() >= 0) {
                    SemanticOp op = new SemanticOp(ops.size(), insn, line);
                    opIndices.put(insn, op.index);
                    ops.add(op);
                    insnIndices.add(i);
                }
            }
        }

        private boolean isFused(SemanticOp compare) {
            int next = compare.index + 1;
            return next < ops.size() && ops.get(next).compare == compare.index;
        }

        @Nullable
        private Frame<BasicValue> typeFrame(SemanticOp op) {
            return ir.typeFrames[insnIndices.get(op.index)];
        }

        private Frame<SourceValue> sourceFrame(SemanticOp op) {
            return ir.sourceFrames[insnIndices.get(op.index)];
        }

        private static ValType[] wasmStack(Frame<BasicValue> frame) {
            List<ValType> types = new ArrayList<>();
            for (int i = 0; i < frame.getStackSize(); i++) {
                Type type = frame.getStack(i).getType();
                ValType valType = type == null ? null : ValType.fromJava(type);
                if (valType != null) types.add(valType);
            }
            return types.toArray(new ValType[0]);
        }

        @Nullable
        private ValType topType(SemanticOp op) {
            Frame<BasicValue> frame = typeFrame(op);
            Type type = frame.getStack(frame.getStackSize() - 1).getType();
            return type == null ? null : ValType.fromJava(type);
        }

        /**
         * The op index of the first real instruction at or after a label.
         */
        private int opIndexOf(LabelNode label) {
            for (AbstractInsnNode insn = label; insn != null; insn = insn.getNext()) {
                Integer index = opIndices.get(insn);
                if (index != null) return index;
            }
            return ops.size();
        }

        private List<ValueRef> inputs(SemanticOp op, int count) {
            Frame<SourceValue> frame = sourceFrame(op);
            List<ValueRef> refs = new ArrayList<>(count);
            int top = frame.getStackSize();
            for (int i = top - count; i < top; i++) {
                Set<AbstractInsnNode> producers = frame.getStack(i).insns;
                int[] indices = new int[producers.size()];
                int j = 0;
                for (AbstractInsnNode producer : producers) {
                    indices[j++] = opIndices.get(producer);
                }
                refs.add(new ValueRef(indices));
            }
            return refs;
        }

        private UnsupportedOpException unsupported(SemanticOp op, String message) {
            return new UnsupportedOpException(subject, op.index,
                    (op.line >= 0 ? "line " + op.line + ": " : "") + message);
        }

        private void loadAccessor(SemanticOp op) {
            int var = ((VarInsnNode) op.insn).var;
            CapturedValue captured = ir.capturedAt(var);
            if (captured == null || captured.kind == CapturedValue.Kind.CONSTANT) {
                throw unsupported(op, "loads a reference from local " + var
                        + "; handlers may only use signal accessors and primitive values");
            }
            op.kind = SemanticOpKind.ACCESSOR;
            op.signalId = captured.signalId;
        }

        @Nullable
        private CapturedValue.Kind accessorKind(SemanticOp accessor) {
            CapturedValue captured = ir.capturedAt(((VarInsnNode) accessor.insn).var);
            return captured == null ? null : captured.kind;
        }

        /**
         * Find the signal a receiver was loaded from.
         *
         * @return The signal, or -1 if the receiver is not one accessor of one signal.
         */
        private long receiverSignal(ValueRef receiver, CapturedValue.Kind kind) {
            long signal = -1;
            for (int producer : receiver.getProducers()) {
                SemanticOp source = ops.get(producer);
                if (source.kind != SemanticOpKind.ACCESSOR || accessorKind(source) != kind) return -1;
                if (signal != -1 && signal != source.signalId) return -1;
                signal = source.signalId;
            }
            return signal;
        }

        private void invoke(SemanticOp op) {
            MethodInsnNode min = (MethodInsnNode) op.insn;
            String callee = min.owner + "." + min.name + min.desc;
            if (op.opcode() == INVOKEINTERFACE && min.name.equals("get") && GETTERS.containsKey(min.owner)) {
                Type type = GETTERS.get(min.owner);
                if (min.desc.equals(Type.getMethodDescriptor(type))) {
                    List<ValueRef> inputs = inputs(op, 1);
                    long signal = receiverSignal(inputs.get(0), CapturedValue.Kind.GETTER);
                    if (signal < 0) {
                        throw unsupported(op, "calls " + callee + " on a value that is not a captured getter");
                    }
                    op.kind = SemanticOpKind.READ;
                    op.inputs = inputs;
                    op.signalId = signal;
                    op.type = ValType.fromJava(type);
                    return;
                }
            }
            if (op.opcode() == INVOKEINTERFACE && min.name.equals("set") && SETTERS.containsKey(min.owner)) {
                Type type = SETTERS.get(min.owner);
                if (min.desc.equals(Type.getMethodDescriptor(Type.VOID_TYPE, type))) {
                    List<ValueRef> inputs = inputs(op, 2);
                    long signal = receiverSignal(inputs.get(0), CapturedValue.Kind.SETTER);
                    if (signal < 0) {
                        throw unsupported(op, "calls " + callee + " on a value that is not a captured setter");
                    }
                    op.kind = SemanticOpKind.WRITE;
                    op.inputs = inputs;
                    op.signalId = signal;
                    op.type = ValType.fromJava(type);
                    return;
                }
            }
            throw unsupported(op, "calls " + callee + "; handlers may only call signal getters and setters");
        }

        private void classify(SemanticOp op) {
            int opcode = op.opcode();
            switch (opcode) {
                case Opcodes.NOP:
                    return;
                case ICONST_M1:
                case ICONST_0:
                case ICONST_1:
                case ICONST_2:
                case ICONST_3:
                case ICONST_4:
                case ICONST_5:
                    constant(op, opcode - ICONST_0);
                    return;
                case BIPUSH:
                case SIPUSH:
                    constant(op, ((IntInsnNode) op.insn).operand);
                    return;
                case LCONST_0:
                case LCONST_1:
                    constant(op, (long) (opcode - LCONST_0));
                    return;
                case FCONST_0:
                case FCONST_1:
                case FCONST_2:
                    constant(op, (float) (opcode - FCONST_0));
                    return;
                case DCONST_0:
                case DCONST_1:
                    constant(op, (double) (opcode - DCONST_0));
                    return;
                case LDC: {
                    Object cst = ((LdcInsnNode) op.insn).cst;
                    if (cst instanceof Integer || cst instanceof Long || cst instanceof Float || cst instanceof Double) {
                        constant(op, (Number) cst);
                        return;
                    }
                    throw unsupported(op, "loads a constant of type " + cst.getClass().getSimpleName());
                }
                case ILOAD:
                case LLOAD:
                case FLOAD:
                case DLOAD:
                    load(op);
                    return;
                case ISTORE:
                case LSTORE:
                case FSTORE:
                case DSTORE:
                    store(op);
                    return;
                case IADD:
                case LADD:
                case FADD:
                case DADD:
                    arithmetic(op, SemanticOpKind.ADD);
                    return;
                case ISUB:
                case LSUB:
                case FSUB:
                case DSUB:
                    arithmetic(op, SemanticOpKind.SUB);
                    return;
                case IMUL:
                case LMUL:
                case FMUL:
                case DMUL:
                    arithmetic(op, SemanticOpKind.MUL);
                    return;
                case LCMP:
                case FCMPL:
                case FCMPG:
                case DCMPL:
                case DCMPG:
                    op.kind = SemanticOpKind.COMPARE;
                    op.inputs = inputs(op, 2);
                    op.type = topType(op);
                    return;
                case IFEQ:
                case IFNE:
                case IFLT:
                case IFGE:
                case IFGT:
                case IFLE:
                    branch(op, 1);
                    return;
                case IF_ICMPEQ:
                case IF_ICMPNE:
                case IF_ICMPLT:
                case IF_ICMPGE:
                case IF_ICMPGT:
                case IF_ICMPLE:
                    branch(op, 2);
                    return;
                case GOTO:
                    op.kind = SemanticOpKind.JUMP;
                    op.target = forwardTarget(op);
                    return;
                case RETURN:
                    op.kind = SemanticOpKind.RETURN;
                    return;
                case POP:
                    discard(op);
                    return;
                case POP2: {
                    Frame<BasicValue> frame = typeFrame(op);
                    if (frame.getStack(frame.getStackSize() - 1).getSize() != 2) {
                        throw unsupported(op, "pop2 of two single-slot values");
                    }
                    discard(op);
                    return;
                }
                case I2L:
                case I2F:
                case I2D:
                case L2I:
                case L2F:
                case L2D:
                case F2I:
                case F2L:
                case F2D:
                case D2I:
                case D2L:
                case D2F:
                case I2B:
                case I2S:
                case I2C:
                    op.kind = SemanticOpKind.CONVERT;
                    op.inputs = inputs(op, 1);
                    op.type = convertResult(opcode);
                    return;
                default:
                    throw unsupported(op, "unsupported instruction " + op.mnemonic());
            }
        }

        private void constant(SemanticOp op, Number value) {
            op.kind = SemanticOpKind.CONST;
            op.constant = value;
            if (value instanceof Long) {
                op.type = ValType.I64;
            } else if (value instanceof Float) {
                op.type = ValType.F32;
            } else if (value instanceof Double) {
                op.type = ValType.F64;
            } else {
                op.type = ValType.I32;
            }
        }

        private void load(SemanticOp op) {
            int var = ((VarInsnNode) op.insn).var;
            CapturedValue captured = ir.capturedAt(var);
            if (captured != null) {
                if (captured.kind != CapturedValue.Kind.CONSTANT || captured.constant == null) {
                    throw unsupported(op, "loads captured value " + captured.index + " as a primitive");
                }
                constant(op, captured.constant);
                op.type = ValType.fromJava(captured.type);
                return;
            }
            op.kind = SemanticOpKind.LOAD_LOCAL;
            op.local = var;
            op.type = localType(op.opcode() - ILOAD);
        }

        private void store(SemanticOp op) {
            int var = ((VarInsnNode) op.insn).var;
            if (var < ir.parameterSlots()) {
                throw unsupported(op, "overwrites captured value in local " + var);
            }
            op.kind = SemanticOpKind.STORE_LOCAL;
            op.local = var;
            op.inputs = inputs(op, 1);
            op.type = localType(op.opcode() - ISTORE);
        }

        private static ValType localType(int offset) {
            // ILOAD, LLOAD, FLOAD, DLOAD and the stores are consecutive
            switch (offset) {
                case 0:
                    return ValType.I32;
                case 1:
                    return ValType.I64;
                case 2:
                    return ValType.F32;
                default:
                    return ValType.F64;
            }
        }

        private void arithmetic(SemanticOp op, SemanticOpKind kind) {
            List<ValueRef> inputs = inputs(op, 2);
            if (!isConstant(inputs.get(0)) && !isConstant(inputs.get(1))) {
                throw unsupported(op, op.mnemonic() + " of two non-constant values; "
                        + "signal arithmetic needs a constant operand");
            }
            op.kind = kind;
            op.inputs = inputs;
            op.type = topType(op);
        }

        private boolean isConstant(ValueRef ref) {
            return !ref.isPhi() && ops.get(ref.single()).kind == SemanticOpKind.CONST;
        }

        private void branch(SemanticOp op, int operands) {
            op.kind = SemanticOpKind.BRANCH;
            op.inputs = inputs(op, operands);
            op.comparison = Comparison.ofJump(op.opcode());
            op.target = forwardTarget(op);
            op.type = ValType.I32;
            if (operands == 1 && !op.inputs.get(0).isPhi()) {
                SemanticOp producer = ops.get(op.inputs.get(0).single());
                if (producer.kind == SemanticOpKind.COMPARE) {
                    if (producer.index != op.index - 1) {
                        throw unsupported(producer, "the result of " + producer.mnemonic()
                                + " must be tested by the next instruction");
                    }
                    op.compare = producer.index;
                    op.type = producer.type;
                    stacks[op.index] = stacks[producer.index];
                }
            }
        }

        private int forwardTarget(SemanticOp op) {
            int target = opIndexOf(((JumpInsnNode) op.insn).label);
            if (target <= op.index) {
                throw unsupported(op, "backward " + op.mnemonic() + "; loops are not supported");
            }
            return target;
        }

        private void discard(SemanticOp op) {
            op.kind = SemanticOpKind.DISCARD;
            op.inputs = inputs(op, 1);
            op.type = topType(op);
        }

        private static ValType convertResult(int opcode) {
            switch (opcode) {
                case I2L:
                case F2L:
                case D2L:
                    return ValType.I64;
                case I2F:
                case L2F:
                case D2F:
                    return ValType.F32;
                case I2D:
                case L2D:
                case F2D:
                    return ValType.F64;
                default:
                    return ValType.I32;
            }
        }
    }
}
