package io.github.sigwasm.core.ops;

import io.github.sigwasm.core.wasm.ValType;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.util.Printer;

import java.util.Collections;
import java.util.List;

/**
 * One instruction of a handler, classified into the {@link SemanticOpKind vocabulary}.
 * <p>
 * The index of an operation is also the id of the value it produces, which other operations refer to
 * through {@link ValueRef}s.
 */
public final class SemanticOp {
    /**
     * The index of this operation among the real instructions of the handler.
     */
    public final int index;
    public final AbstractInsnNode insn;
    /**
     * The source line of this operation, or -1 if unknown.
     */
    public final int line;

    public SemanticOpKind kind = SemanticOpKind.NOP;
    /**
     * The values consumed, bottom of the stack first.
     */
    public List<ValueRef> inputs = Collections.emptyList();
    /**
     * The value type produced, stored or discarded; the operand type of comparisons and branches;
     * the result type of conversions. Null for operations on accessors.
     */
    @Nullable
    public ValType type;
    /**
     * The signal of an {@link SemanticOpKind#ACCESSOR}, {@link SemanticOpKind#READ} or
     * {@link SemanticOpKind#WRITE}, otherwise -1.
     */
    public long signalId = -1;
    /**
     * The value of a {@link SemanticOpKind#CONST}.
     */
    @Nullable
    public Number constant;
    /**
     * The index of the operation a {@link SemanticOpKind#BRANCH} or {@link SemanticOpKind#JUMP} goes to.
     */
    public int target = -1;
    /**
     * The {@link SemanticOpKind#COMPARE} fused into a {@link SemanticOpKind#BRANCH}, or -1.
     */
    public int compare = -1;
    /**
     * The relation a {@link SemanticOpKind#BRANCH} jumps on.
     */
    @Nullable
    public Comparison comparison;
    /**
     * The JVM local slot of a {@link SemanticOpKind#LOAD_LOCAL} or {@link SemanticOpKind#STORE_LOCAL}.
     */
    public int local = -1;
    /**
     * The shape of a {@link SemanticOpKind#WRITE}.
     */
    @Nullable
    public WriteKind writeKind;
    /**
     * Whether this operation can never execute.
     */
    public boolean dead;

    public SemanticOp(int index, AbstractInsnNode insn, int line) {
        this.index = index;
        this.insn = insn;
        this.line = line;
    }

    public int opcode() {
        return insn.getOpcode();
    }

    /**
     * Get the JVM mnemonic of this operation's instruction.
     *
     * @return The mnemonic.
     */
    public String mnemonic() {
        int opcode = insn.getOpcode();
        return opcode >= 0 && opcode < Printer.OPCODES.length
                ? Printer.OPCODES[opcode].toLowerCase()
                : "<" + opcode + ">";
    }

    public boolean isJump() {
        return kind == SemanticOpKind.BRANCH || kind == SemanticOpKind.JUMP;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("%").append(index).append(" = ").append(kind);
        if (signalId >= 0) sb.append(" signal_").append(signalId);
        if (constant != null) sb.append(' ').append(constant);
        if (comparison != null) sb.append(' ').append(comparison);
        if (target >= 0) sb.append(" -> ").append(target);
        if (local >= 0) sb.append(" local ").append(local);
        if (!inputs.isEmpty()) sb.append(' ').append(inputs);
        if (type != null) sb.append(" : ").append(type);
        if (writeKind != null) sb.append(" (").append(writeKind).append(')');
        if (dead) sb.append(" dead");
        return sb.toString();
    }
}
