package io.github.sigwasm.core.wasm;

import io.github.sigwasm.core.ModuleEncodingException;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes function bodies into flat instruction lists.
 */
public class InstructionReader {
    /**
     * Decode an expression, up to and including its final {@code end}.
     *
     * @param body The encoded expression.
     * @return The instructions.
     * @throws ModuleEncodingException If an unknown instruction is encountered.
     */
    public static List<Instruction> read(byte[] body) {
        ByteInput in = new ByteInput(body);
        List<Instruction> insns = new ArrayList<>();
        while (in.hasMore()) {
            int opcode = in.get();
            if (opcode == Opcodes.PREFIX_FC) {
                opcode = 0xFC00 | in.getIndex();
            }
            long immediate = 0;
            switch (opcode) {
                case Opcodes.BLOCK:
                case Opcodes.IF:
                    immediate = in.get();
                    break;
                case Opcodes.BR:
                case Opcodes.BR_IF:
                case Opcodes.CALL:
                case Opcodes.LOCAL_GET:
                case Opcodes.LOCAL_SET:
                case Opcodes.LOCAL_TEE:
                case Opcodes.GLOBAL_GET:
                case Opcodes.GLOBAL_SET:
                    immediate = in.getU32();
                    break;
                case Opcodes.I32_CONST:
                    immediate = in.getS32();
                    break;
                case Opcodes.I64_CONST:
                    immediate = in.getS64();
                    break;
                case Opcodes.F32_CONST:
                    immediate = Float.floatToRawIntBits(in.getF32());
                    break;
                case Opcodes.F64_CONST:
                    immediate = Double.doubleToRawLongBits(in.getF64());
                    break;
                default:
                    if (Opcodes.getMnemonic(opcode) == null) {
                        throw new ModuleEncodingException(String.format(
                                "unknown opcode 0x%x at offset %d", opcode, in.position() - 1));
                    }
            }
            insns.add(new Instruction(opcode, immediate));
        }
        return insns;
    }

    /**
     * Get whether an instruction carries an index or integer immediate.
     *
     * @param opcode The opcode.
     * @return Whether it has an immediate.
     */
    public static boolean hasImmediate(int opcode) {
        switch (opcode) {
            case Opcodes.BR:
            case Opcodes.BR_IF:
            case Opcodes.CALL:
            case Opcodes.LOCAL_GET:
            case Opcodes.LOCAL_SET:
            case Opcodes.LOCAL_TEE:
            case Opcodes.GLOBAL_GET:
            case Opcodes.GLOBAL_SET:
            case Opcodes.I32_CONST:
            case Opcodes.I64_CONST:
                return true;
            default:
                return false;
        }
    }
}
