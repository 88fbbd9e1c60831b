package io.github.sigwasm.core.code;

import io.github.sigwasm.core.wasm.Opcodes;
import io.github.sigwasm.core.wasm.ValType;

import java.util.Arrays;

/**
 * A plain instruction, with its stack effect.
 *
 * @see Insns
 */
public final class InsnNode extends CodeNode {
    public final int opcode;
    /**
     * The immediate: an index, an integer constant, or the raw bits of a float constant.
     */
    public final long immediate;
    /**
     * The types this instruction pops, bottom first.
     */
    public final ValType[] pops;
    /**
     * The types this instruction pushes, bottom first.
     */
    public final ValType[] pushes;

    public InsnNode(int opcode, long immediate, ValType[] pops, ValType[] pushes) {
        this.opcode = opcode;
        this.immediate = immediate;
        this.pops = pops;
        this.pushes = pushes;
    }

    @Override
    public String toString() {
        String mnemonic = Opcodes.getMnemonic(opcode);
        return (mnemonic == null ? Integer.toHexString(opcode) : mnemonic)
                + (immediate != 0 ? " " + immediate : "")
                + " " + Arrays.toString(pops) + " -> " + Arrays.toString(pushes);
    }
}
