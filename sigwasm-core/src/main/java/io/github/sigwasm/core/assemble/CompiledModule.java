package io.github.sigwasm.core.assemble;

import io.github.sigwasm.core.ops.WriteKind;
import io.github.sigwasm.core.wasm.WasmModule;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An assembled module, with the names a host needs to drive it.
 */
public final class CompiledModule {
    private final byte[] bytes;
    private final WasmModule module;
    private final List<String> functionExports;
    private final Map<Long, Integer> signalGlobals;
    private final List<String> attributeNames;
    private final Map<Integer, Map<Long, List<WriteKind>>> writeKinds;

    public CompiledModule(
            byte[] bytes,
            WasmModule module,
            List<String> functionExports,
            Map<Long, Integer> signalGlobals,
            List<String> attributeNames,
            Map<Integer, Map<Long, List<WriteKind>>> writeKinds
    ) {
        this.bytes = bytes;
        this.module = module;
        this.functionExports = Collections.unmodifiableList(functionExports);
        this.signalGlobals = Collections.unmodifiableMap(signalGlobals);
        this.attributeNames = Collections.unmodifiableList(attributeNames);
        this.writeKinds = Collections.unmodifiableMap(writeKinds);
    }

    /**
     * Get the binary module.
     *
     * @return A copy of the bytes.
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    public WasmModule getModule() {
        return module;
    }

    /**
     * Get the names of the exported functions, in function index order.
     *
     * @return The names.
     */
    public List<String> getFunctionExports() {
        return functionExports;
    }

    /**
     * Get the global index of each signal.
     *
     * @return A map from signal id to global index.
     */
    public Map<Long, Integer> getSignalGlobals() {
        return signalGlobals;
    }

    /**
     * Get the names that the attribute index of {@code update_attr} refers to.
     *
     * @return The attribute names.
     */
    public List<String> getAttributeNames() {
        return attributeNames;
    }

    /**
     * Get the shape of every write a handler makes.
     *
     * @param handlerId The handler.
     * @return A map from signal id to the kinds of its writes, in order, empty for unknown handlers.
     */
    public Map<Long, List<WriteKind>> getWriteKinds(int handlerId) {
        Map<Long, List<WriteKind>> kinds = writeKinds.get(handlerId);
        return kinds == null ? Collections.emptyMap() : kinds;
    }
}
