package io.github.sigwasm.core.wasm;

/**
 * An exported function or global.
 */
public final class ExportEntry {
    /**
     * Export kind of functions.
     */
    public static final byte FUNC = 0x00;
    /**
     * Export kind of globals.
     */
    public static final byte GLOBAL = 0x03;

    public final String name;
    public final byte kind;
    public final int index;

    public ExportEntry(String name, byte kind, int index) {
        this.name = name;
        this.kind = kind;
        this.index = index;
    }

    @Override
    public String toString() {
        return "(export \"" + name + "\" (" + (kind == FUNC ? "func " : "global ") + index + "))";
    }
}
