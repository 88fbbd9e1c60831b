package io.github.sigwasm.core.wasm;

import io.github.sigwasm.core.ModuleEncodingException;

/**
 * Serializes a {@link WasmModule} to the WebAssembly binary format.
 */
public class ModuleWriter {
    /**
     * Encode a module.
     *
     * @param module The module.
     * @return The bytes of the module.
     * @throws ModuleEncodingException If an index, length or value is out of range.
     */
    public static byte[] write(WasmModule module) {
        if (module.functions.size() != module.codes.size()) {
            throw new ModuleEncodingException("function and code counts differ: "
                    + module.functions.size() + " != " + module.codes.size());
        }
        ByteOutput out = new ByteOutput();
        out.putBytes(Opcodes.MAGIC);
        out.put(Opcodes.VERSION).put(0).put(0).put(0);

        if (!module.types.isEmpty()) {
            ByteOutput sec = new ByteOutput().putU32(module.types.size());
            for (FuncType type : module.types) {
                sec.put(Opcodes.TYPE_FUNC);
                putTypes(sec, type.params.toArray(new ValType[0]));
                putTypes(sec, type.results.toArray(new ValType[0]));
            }
            section(out, Opcodes.SECTION_TYPE, sec);
        }

        if (!module.imports.isEmpty()) {
            ByteOutput sec = new ByteOutput().putU32(module.imports.size());
            for (ImportEntry imp : module.imports) {
                checkIndex(imp.typeIndex, module.types.size(), "type");
                sec.putName(imp.module).putName(imp.name).put(Opcodes.IMPORT_FUNC).putU32(imp.typeIndex);
            }
            section(out, Opcodes.SECTION_IMPORT, sec);
        }

        if (!module.functions.isEmpty()) {
            ByteOutput sec = new ByteOutput().putU32(module.functions.size());
            for (int typeIndex : module.functions) {
                checkIndex(typeIndex, module.types.size(), "type");
                sec.putU32(typeIndex);
            }
            section(out, Opcodes.SECTION_FUNCTION, sec);
        }

        if (!module.globals.isEmpty()) {
            ByteOutput sec = new ByteOutput().putU32(module.globals.size());
            for (GlobalEntry global : module.globals) {
                sec.put(global.type.code).put(global.mutable ? 1 : 0);
                putConst(sec, global.type, global.init);
                sec.put(Opcodes.END);
            }
            section(out, Opcodes.SECTION_GLOBAL, sec);
        }

        if (!module.exports.isEmpty()) {
            ByteOutput sec = new ByteOutput().putU32(module.exports.size());
            int funcCount = module.imports.size() + module.functions.size();
            for (ExportEntry export : module.exports) {
                checkIndex(export.index,
                        export.kind == ExportEntry.FUNC ? funcCount : module.globals.size(),
                        export.kind == ExportEntry.FUNC ? "function" : "global");
                sec.putName(export.name).put(export.kind).putU32(export.index);
            }
            section(out, Opcodes.SECTION_EXPORT, sec);
        }

        if (!module.codes.isEmpty()) {
            ByteOutput sec = new ByteOutput().putU32(module.codes.size());
            for (CodeEntry code : module.codes) {
                ByteOutput fn = new ByteOutput();
                putLocals(fn, code);
                fn.putBytes(code.body);
                sec.putSized(fn);
            }
            section(out, Opcodes.SECTION_CODE, sec);
        }
        return out.toByteArray();
    }

    private static void section(ByteOutput out, byte id, ByteOutput content) {
        out.put(id).putSized(content);
    }

    private static void putTypes(ByteOutput out, ValType[] types) {
        out.putU32(types.length);
        for (ValType type : types) {
            out.put(type.code);
        }
    }

    private static void putLocals(ByteOutput out, CodeEntry code) {
        // runs of equal types
        int runs = 0;
        ValType last = null;
        for (ValType local : code.locals) {
            if (local != last) runs++;
            last = local;
        }
        out.putU32(runs);
        int i = 0;
        while (i < code.locals.size()) {
            ValType type = code.locals.get(i);
            int j = i;
            while (j < code.locals.size() && code.locals.get(j) == type) j++;
            out.putU32(j - i).put(type.code);
            i = j;
        }
    }

    /**
     * Write a constant instruction of the given type.
     *
     * @param out   The output.
     * @param type  The type.
     * @param value The value.
     */
    public static void putConst(ByteOutput out, ValType type, Number value) {
        switch (type) {
            case I32:
                out.put(Opcodes.I32_CONST).putS32(value.intValue());
                break;
            case I64:
                out.put(Opcodes.I64_CONST).putS64(value.longValue());
                break;
            case F32:
                out.put(Opcodes.F32_CONST).putF32(value.floatValue());
                break;
            case F64:
                out.put(Opcodes.F64_CONST).putF64(value.doubleValue());
                break;
        }
    }

    private static void checkIndex(int index, int bound, String what) {
        if (index < 0 || index >= bound) {
            throw new ModuleEncodingException(what + " index " + index + " out of bounds (" + bound + ")");
        }
    }
}
