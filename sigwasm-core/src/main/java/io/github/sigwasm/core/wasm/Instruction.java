package io.github.sigwasm.core.wasm;

/**
 * A decoded instruction.
 */
public final class Instruction {
    public final int opcode;
    /**
     * The immediate: an index, a label depth, a block type, an integer constant,
     * or the raw bits of a float constant. Zero for instructions without one.
     */
    public final long immediate;

    public Instruction(int opcode, long immediate) {
        this.opcode = opcode;
        this.immediate = immediate;
    }

    public float f32() {
        return Float.intBitsToFloat((int) immediate);
    }

    public double f64() {
        return Double.longBitsToDouble(immediate);
    }

    @Override
    public String toString() {
        String mnemonic = Opcodes.getMnemonic(opcode);
        if (mnemonic == null) mnemonic = String.format("<0x%x>", opcode);
        switch (opcode) {
            case Opcodes.BLOCK:
            case Opcodes.IF:
                return (byte) immediate == Opcodes.EMPTY_BLOCK_TYPE
                        ? mnemonic
                        : mnemonic + " (result " + ValType.fromCode((byte) immediate) + ")";
            case Opcodes.F32_CONST:
                return mnemonic + " " + f32();
            case Opcodes.F64_CONST:
                return mnemonic + " " + f64();
            default:
                return InstructionReader.hasImmediate(opcode) ? mnemonic + " " + immediate : mnemonic;
        }
    }
}
