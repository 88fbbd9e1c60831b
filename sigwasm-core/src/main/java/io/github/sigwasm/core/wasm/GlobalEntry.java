package io.github.sigwasm.core.wasm;

import java.util.Objects;

/**
 * A global variable, with a constant initial value.
 */
public final class GlobalEntry {
    public final ValType type;
    public final boolean mutable;
    /**
     * The initial value: an {@link Integer}, {@link Long}, {@link Float} or {@link Double}
     * according to {@link #type}.
     */
    public final Number init;

    public GlobalEntry(ValType type, boolean mutable, Number init) {
        this.type = type;
        this.mutable = mutable;
        this.init = init;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GlobalEntry that = (GlobalEntry) o;
        return mutable == that.mutable && type == that.type && init.equals(that.init);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, mutable, init);
    }

    @Override
    public String toString() {
        return "(global " + (mutable ? "(mut " + type + ")" : type) + " " + init + ")";
    }
}
