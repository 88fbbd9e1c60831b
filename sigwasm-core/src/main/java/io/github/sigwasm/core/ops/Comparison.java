package io.github.sigwasm.core.ops;

import org.objectweb.asm.Opcodes;

/**
 * A relation tested by a branch.
 */
public enum Comparison {
    EQ,
    NE,
    LT,
    GE,
    GT,
    LE,
    ;

    /**
     * Get the relation that holds exactly when this one does not, ignoring NaN.
     *
     * @return The negated relation.
     */
    public Comparison negate() {
        switch (this) {
            case EQ:
                return NE;
            case NE:
                return EQ;
            case LT:
                return GE;
            case GE:
                return LT;
            case GT:
                return LE;
            default:
                return GT;
        }
    }

    /**
     * Test the relation on the result of a three-way comparison.
     *
     * @param cmp A negative, zero or positive number.
     * @return Whether the relation holds between it and zero.
     */
    public boolean test(long cmp) {
        switch (this) {
            case EQ:
                return cmp == 0;
            case NE:
                return cmp != 0;
            case LT:
                return cmp < 0;
            case GE:
                return cmp >= 0;
            case GT:
                return cmp > 0;
            default:
                return cmp <= 0;
        }
    }

    /**
     * Get the relation of a JVM conditional jump.
     *
     * @param opcode One of {@code IFEQ..IFLE} or {@code IF_ICMPEQ..IF_ICMPLE}.
     * @return The relation the jump is taken on.
     */
    public static Comparison ofJump(int opcode) {
        switch (opcode) {
            case Opcodes.IFEQ:
            case Opcodes.IF_ICMPEQ:
                return EQ;
            case Opcodes.IFNE:
            case Opcodes.IF_ICMPNE:
                return NE;
            case Opcodes.IFLT:
            case Opcodes.IF_ICMPLT:
                return LT;
            case Opcodes.IFGE:
            case Opcodes.IF_ICMPGE:
                return GE;
            case Opcodes.IFGT:
            case Opcodes.IF_ICMPGT:
                return GT;
            case Opcodes.IFLE:
            case Opcodes.IF_ICMPLE:
                return LE;
            default:
                throw new IllegalArgumentException("not a conditional jump: " + opcode);
        }
    }
}
