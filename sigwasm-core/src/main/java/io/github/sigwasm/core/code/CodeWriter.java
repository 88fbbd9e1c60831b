package io.github.sigwasm.core.code;

import io.github.sigwasm.core.ModuleEncodingException;
import io.github.sigwasm.core.wasm.ByteOutput;
import io.github.sigwasm.core.wasm.CodeEntry;
import io.github.sigwasm.core.wasm.Opcodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes a {@link FunctionBody} tree into a {@link CodeEntry}, resolving branch targets to label depths.
 */
public class CodeWriter {
    /**
     * Encode a function body.
     *
     * @param fn The function body.
     * @return The encoded code.
     */
    public static CodeEntry write(FunctionBody fn) {
        ByteOutput out = new ByteOutput();
        writeAll(out, fn.body, new ArrayList<>());
        out.put(Opcodes.END);
        return new CodeEntry(fn.locals, out.toByteArray());
    }

    private static void writeAll(ByteOutput out, List<CodeNode> nodes, List<BlockNode> labels) {
        for (CodeNode node : nodes) {
            write(out, node, labels);
        }
    }

    private static void write(ByteOutput out, CodeNode node, List<BlockNode> labels) {
        if (node instanceof InsnNode) {
            writeInsn(out, (InsnNode) node);
        } else if (node instanceof BlockNode) {
            BlockNode block = (BlockNode) node;
            out.put(block.kind == BlockNode.Kind.IF ? Opcodes.IF : Opcodes.BLOCK);
            out.put(block.result == null ? Opcodes.EMPTY_BLOCK_TYPE : block.result.code);
            labels.add(block);
            writeAll(out, block.body, labels);
            if (block.elseBody != null) {
                out.put(Opcodes.ELSE);
                writeAll(out, block.elseBody, labels);
            }
            labels.remove(labels.size() - 1);
            out.put(Opcodes.END);
        } else if (node instanceof BranchNode) {
            BranchNode branch = (BranchNode) node;
            int index = labels.lastIndexOf(branch.target);
            if (index < 0) {
                throw new ModuleEncodingException("branch to a block that does not enclose it");
            }
            out.put(branch.conditional ? Opcodes.BR_IF : Opcodes.BR).putU32(labels.size() - 1 - index);
        } else if (node instanceof ReturnNode) {
            out.put(Opcodes.RETURN);
        } else {
            throw new ModuleEncodingException("cannot encode " + node);
        }
    }

    private static void writeInsn(ByteOutput out, InsnNode insn) {
        int opcode = insn.opcode;
        if (opcode > 0xFF) {
            out.put(Opcodes.PREFIX_FC).putU32(opcode & 0xFF);
        } else {
            out.put(opcode);
        }
        switch (opcode) {
            case Opcodes.CALL:
            case Opcodes.LOCAL_GET:
            case Opcodes.LOCAL_SET:
            case Opcodes.LOCAL_TEE:
            case Opcodes.GLOBAL_GET:
            case Opcodes.GLOBAL_SET:
                out.putU32(insn.immediate);
                break;
            case Opcodes.I32_CONST:
                out.putS32((int) insn.immediate);
                break;
            case Opcodes.I64_CONST:
                out.putS64(insn.immediate);
                break;
            case Opcodes.F32_CONST:
                out.putF32(Float.intBitsToFloat((int) insn.immediate));
                break;
            case Opcodes.F64_CONST:
                out.putF64(Double.longBitsToDouble(insn.immediate));
                break;
            default:
                break;
        }
    }
}
