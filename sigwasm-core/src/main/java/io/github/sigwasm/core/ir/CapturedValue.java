package io.github.sigwasm.core.ir;

import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;

/**
 * A value captured by a handler closure, as seen by its implementation method.
 */
public final class CapturedValue {
    /**
     * What a captured value is.
     */
    public enum Kind {
        GETTER,
        SETTER,
        CONSTANT,
    }

    public final Kind kind;
    /**
     * The index of the value among the captured arguments.
     */
    public final int index;
    /**
     * The local variable slot the value occupies in the implementation method.
     */
    public final int slot;
    public final Type type;
    /**
     * The signal of a {@link Kind#GETTER} or {@link Kind#SETTER}, or -1.
     */
    public final long signalId;
    /**
     * The value of a {@link Kind#CONSTANT}, as an int, long, float or double, or null.
     */
    @Nullable
    public final Number constant;

    private CapturedValue(Kind kind, int index, int slot, Type type, long signalId, @Nullable Number constant) {
        this.kind = kind;
        this.index = index;
        this.slot = slot;
        this.type = type;
        this.signalId = signalId;
        this.constant = constant;
    }

    public static CapturedValue accessor(Kind kind, int index, int slot, Type type, long signalId) {
        return new CapturedValue(kind, index, slot, type, signalId, null);
    }

    public static CapturedValue constant(int index, int slot, Type type, Number value) {
        return new CapturedValue(Kind.CONSTANT, index, slot, type, -1, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case GETTER:
                return "getter(signal_" + signalId + ")";
            case SETTER:
                return "setter(signal_" + signalId + ")";
            default:
                return "const(" + constant + ")";
        }
    }
}
