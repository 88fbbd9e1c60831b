package io.github.sigwasm.core.code;

import io.github.sigwasm.core.wasm.FuncType;
import io.github.sigwasm.core.wasm.Opcodes;
import io.github.sigwasm.core.wasm.ValType;

import java.util.HashMap;
import java.util.Map;

import static io.github.sigwasm.core.wasm.ValType.*;

/**
 * Factories for {@link InsnNode}s, which know the stack effect of each instruction.
 */
public final class Insns {
    private Insns() {
    }

    private static final ValType[] NONE = {};
    private static final Map<Integer, ValType[][]> SIGNATURES = new HashMap<>();

    private static void sig(ValType[] pops, ValType[] pushes, int... opcodes) {
        for (int opcode : opcodes) {
            SIGNATURES.put(opcode, new ValType[][]{pops, pushes});
        }
    }

    private static ValType[] t(ValType... types) {
        return types;
    }

    static {
        sig(t(I32), t(I32), Opcodes.I32_EQZ, Opcodes.I32_EXTEND8_S, Opcodes.I32_EXTEND16_S);
        sig(t(I32, I32), t(I32),
                Opcodes.I32_EQ, Opcodes.I32_NE, Opcodes.I32_LT_S, Opcodes.I32_GT_S, Opcodes.I32_LE_S, Opcodes.I32_GE_S,
                Opcodes.I32_ADD, Opcodes.I32_SUB, Opcodes.I32_MUL, Opcodes.I32_AND);
        sig(t(I64), t(I32), Opcodes.I64_EQZ, Opcodes.I32_WRAP_I64);
        sig(t(I64, I64), t(I32),
                Opcodes.I64_EQ, Opcodes.I64_NE, Opcodes.I64_LT_S, Opcodes.I64_GT_S, Opcodes.I64_LE_S, Opcodes.I64_GE_S);
        sig(t(I64, I64), t(I64), Opcodes.I64_ADD, Opcodes.I64_SUB, Opcodes.I64_MUL);
        sig(t(F32, F32), t(I32),
                Opcodes.F32_EQ, Opcodes.F32_NE, Opcodes.F32_LT, Opcodes.F32_GT, Opcodes.F32_LE, Opcodes.F32_GE);
        sig(t(F32, F32), t(F32), Opcodes.F32_ADD, Opcodes.F32_SUB, Opcodes.F32_MUL);
        sig(t(F64, F64), t(I32),
                Opcodes.F64_EQ, Opcodes.F64_NE, Opcodes.F64_LT, Opcodes.F64_GT, Opcodes.F64_LE, Opcodes.F64_GE);
        sig(t(F64, F64), t(F64), Opcodes.F64_ADD, Opcodes.F64_SUB, Opcodes.F64_MUL);

        sig(t(I32), t(I64), Opcodes.I64_EXTEND_I32_S);
        sig(t(I32), t(F32), Opcodes.F32_CONVERT_I32_S);
        sig(t(I32), t(F64), Opcodes.F64_CONVERT_I32_S);
        sig(t(I64), t(F32), Opcodes.F32_CONVERT_I64_S);
        sig(t(I64), t(F64), Opcodes.F64_CONVERT_I64_S);
        sig(t(F32), t(F64), Opcodes.F64_PROMOTE_F32);
        sig(t(F64), t(F32), Opcodes.F32_DEMOTE_F64);
        sig(t(F32), t(I32), Opcodes.I32_TRUNC_SAT_F32_S);
        sig(t(F64), t(I32), Opcodes.I32_TRUNC_SAT_F64_S);
        sig(t(F32), t(I64), Opcodes.I64_TRUNC_SAT_F32_S);
        sig(t(F64), t(I64), Opcodes.I64_TRUNC_SAT_F64_S);
        sig(NONE, NONE, Opcodes.NOP);
    }

    /**
     * Create a numeric instruction without immediates.
     *
     * @param opcode The opcode.
     * @return The instruction.
     * @throws IllegalArgumentException If the opcode is not a known numeric instruction.
     */
    public static InsnNode op(int opcode) {
        ValType[][] signature = SIGNATURES.get(opcode);
        if (signature == null) {
            throw new IllegalArgumentException("no signature for opcode 0x" + Integer.toHexString(opcode));
        }
        return new InsnNode(opcode, 0, signature[0], signature[1]);
    }

    public static InsnNode i32Const(int value) {
        return new InsnNode(Opcodes.I32_CONST, value, NONE, t(I32));
    }

    public static InsnNode i64Const(long value) {
        return new InsnNode(Opcodes.I64_CONST, value, NONE, t(I64));
    }

    public static InsnNode f32Const(float value) {
        return new InsnNode(Opcodes.F32_CONST, Float.floatToRawIntBits(value), NONE, t(F32));
    }

    public static InsnNode f64Const(double value) {
        return new InsnNode(Opcodes.F64_CONST, Double.doubleToRawLongBits(value), NONE, t(F64));
    }

    /**
     * Create a constant of the given type.
     *
     * @param type  The type.
     * @param value The value, converted to the type.
     * @return The instruction.
     */
    public static InsnNode constant(ValType type, Number value) {
        switch (type) {
            case I32:
                return i32Const(value.intValue());
            case I64:
                return i64Const(value.longValue());
            case F32:
                return f32Const(value.floatValue());
            default:
                return f64Const(value.doubleValue());
        }
    }

    public static InsnNode localGet(int index, ValType type) {
        return new InsnNode(Opcodes.LOCAL_GET, index, NONE, t(type));
    }

    public static InsnNode localSet(int index, ValType type) {
        return new InsnNode(Opcodes.LOCAL_SET, index, t(type), NONE);
    }

    public static InsnNode globalGet(int index, ValType type) {
        return new InsnNode(Opcodes.GLOBAL_GET, index, NONE, t(type));
    }

    public static InsnNode globalSet(int index, ValType type) {
        return new InsnNode(Opcodes.GLOBAL_SET, index, t(type), NONE);
    }

    public static InsnNode call(int funcIndex, FuncType type) {
        return new InsnNode(Opcodes.CALL, funcIndex,
                type.params.toArray(NONE),
                type.results.toArray(NONE));
    }

    public static InsnNode drop(ValType type) {
        return new InsnNode(Opcodes.DROP, 0, t(type), NONE);
    }

    /**
     * Create an instruction comparing the top value against zero, leaving 1 if it is nonzero.
     *
     * @param type The type of the value.
     * @return The instructions, which leave an {@code i32}.
     */
    public static InsnNode[] nonZero(ValType type) {
        switch (type) {
            case I32:
                return new InsnNode[]{i32Const(0), op(Opcodes.I32_NE)};
            case I64:
                return new InsnNode[]{i64Const(0), op(Opcodes.I64_NE)};
            case F32:
                return new InsnNode[]{f32Const(0), op(Opcodes.F32_NE)};
            default:
                return new InsnNode[]{f64Const(0), op(Opcodes.F64_NE)};
        }
    }
}
