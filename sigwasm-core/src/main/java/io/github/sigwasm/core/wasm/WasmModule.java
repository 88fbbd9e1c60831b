package io.github.sigwasm.core.wasm;

import io.github.sigwasm.core.ModuleEncodingException;

import java.util.*;

/**
 * A WebAssembly module, built incrementally and serialized once by a {@link ModuleWriter}.
 * <p>
 * Only the sections the compiler needs are modelled: types, function imports, functions,
 * globals, exports and code. Function indices count imports first, then defined functions.
 */
public class WasmModule {
    public final List<FuncType> types = new ArrayList<>();
    public final List<ImportEntry> imports = new ArrayList<>();
    /**
     * The type indices of the defined functions.
     */
    public final List<Integer> functions = new ArrayList<>();
    public final List<GlobalEntry> globals = new ArrayList<>();
    public final List<ExportEntry> exports = new ArrayList<>();
    /**
     * The code of the defined functions, parallel to {@link #functions}.
     */
    public final List<CodeEntry> codes = new ArrayList<>();

    private final Map<FuncType, Integer> typeIndices = new HashMap<>();

    /**
     * Get the index of a function type, adding it to the type section if it is not there yet.
     *
     * @param type The function type.
     * @return The index of the type.
     */
    public int typeIndex(FuncType type) {
        Integer index = typeIndices.get(type);
        if (index == null) {
            index = types.size();
            types.add(type);
            typeIndices.put(type, index);
        }
        return index;
    }

    /**
     * Import a function. All imports must be added before any function is defined.
     *
     * @param module The module to import from.
     * @param name   The name of the function.
     * @param type   The type of the function.
     * @return The function index of the import.
     */
    public int addImport(String module, String name, FuncType type) {
        if (!functions.isEmpty()) {
            throw new IllegalStateException("imports must precede defined functions");
        }
        imports.add(new ImportEntry(module, name, typeIndex(type)));
        return imports.size() - 1;
    }

    /**
     * Define a function.
     *
     * @param type The type of the function.
     * @param code The code of the function.
     * @return The function index of the function.
     */
    public int addFunction(FuncType type, CodeEntry code) {
        functions.add(typeIndex(type));
        codes.add(code);
        return imports.size() + functions.size() - 1;
    }

    public int addGlobal(GlobalEntry global) {
        globals.add(global);
        return globals.size() - 1;
    }

    public void addExport(String name, byte kind, int index) {
        for (ExportEntry export : exports) {
            if (export.name.equals(name)) {
                throw new ModuleEncodingException("duplicate export " + name);
            }
        }
        exports.add(new ExportEntry(name, kind, index));
    }
}
