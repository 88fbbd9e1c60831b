package io.github.sigwasm.core.wasm;

/**
 * An imported function.
 */
public final class ImportEntry {
    public final String module;
    public final String name;
    public final int typeIndex;

    public ImportEntry(String module, String name, int typeIndex) {
        this.module = module;
        this.name = name;
        this.typeIndex = typeIndex;
    }

    @Override
    public String toString() {
        return module + "." + name;
    }
}
