package io.github.sigwasm.test;

import com.dylibso.chicory.runtime.ExportFunction;
import com.dylibso.chicory.runtime.HostFunction;
import com.dylibso.chicory.runtime.ImportValues;
import com.dylibso.chicory.runtime.Instance;
import com.dylibso.chicory.wasm.Parser;
import com.dylibso.chicory.wasm.WasmModule;
import com.dylibso.chicory.wasm.types.Export;
import com.dylibso.chicory.wasm.types.ExportSection;
import com.dylibso.chicory.wasm.types.ExternalType;
import com.dylibso.chicory.wasm.types.FunctionType;
import com.dylibso.chicory.wasm.types.ValType;
import io.github.sigwasm.core.assemble.CompilerOptions;
import io.github.sigwasm.core.assemble.HostImports;

import java.util.*;

/**
 * Runs a compiled module on Chicory against a fake page, recording every host callback and
 * keeping track of what the page would show.
 */
public class DomHost {
    public static final class HostCall {
        public final String name;
        public final List<Number> args;

        public HostCall(String name, List<Number> args) {
            this.name = name;
            this.args = args;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof HostCall)) return false;
            HostCall that = (HostCall) o;
            return name.equals(that.name) && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, args);
        }

        @Override
        public String toString() {
            return name + args;
        }
    }

    public static HostCall call(String name, Number... args) {
        return new HostCall(name, Arrays.asList(args));
    }

    private final WasmModule module;
    private final Instance instance;
    private final List<HostCall> calls = new ArrayList<>();
    private final Map<Integer, Number> texts = new HashMap<>();
    private final Map<Integer, Boolean> visible = new HashMap<>();
    private Boolean darkMode;

    public DomHost(byte[] bytes) {
        this(bytes, CompilerOptions.DEFAULT.getImportModule());
    }

    public DomHost(byte[] bytes, String importModule) {
        module = Parser.parse(bytes);
        ImportValues.Builder imports = ImportValues.builder();
        for (int i = 0; i < HostImports.COUNT; i++) {
            String name = HostImports.name(i);
            List<ValType> params = new ArrayList<>();
            for (io.github.sigwasm.core.wasm.ValType param : HostImports.type(i).params) {
                params.add(valType(param));
            }
            imports.addFunction(new HostFunction(
                    importModule,
                    name,
                    FunctionType.of(params, Collections.emptyList()),
                    (inst, args) -> {
                        host(name, decode(params, args));
                        return null;
                    }));
        }
        instance = Instance.builder(module).withImportValues(imports.build()).build();
    }

    public WasmModule getModule() {
        return module;
    }

    public Number invoke(String export, Number... args) {
        FunctionType type = exportType(module, export);
        ExportFunction fn = instance.export(export);
        long[] raw = new long[args.length];
        for (int i = 0; i < args.length; i++) {
            raw[i] = encode(type.params().get(i), args[i]);
        }
        long[] results = fn.apply(raw);
        if (type.returns().isEmpty()) return null;
        return decode(type.returns().get(0), results[0]);
    }

    /**
     * Read a signal through its exported getter.
     */
    public Number signal(long id) {
        return invoke("get_signal_" + id);
    }

    /**
     * Get and forget the host calls made so far.
     */
    public List<HostCall> takeCalls() {
        List<HostCall> taken = new ArrayList<>(calls);
        calls.clear();
        return taken;
    }

    public Number text(int key) {
        return texts.get(key);
    }

    public Boolean isVisible(int key) {
        return visible.get(key);
    }

    public Boolean isDarkMode() {
        return darkMode;
    }

    private void host(String name, Number[] args) {
        calls.add(new HostCall(name, Arrays.asList(args)));
        switch (name) {
            case "update_text_i32":
            case "update_text_f64":
                texts.put(args[0].intValue(), args[1]);
                break;
            case "set_visible":
                visible.put(args[0].intValue(), args[1].intValue() != 0);
                break;
            case "set_dark_mode":
                darkMode = args[0].intValue() != 0;
                break;
            default:
                break;
        }
    }

    /**
     * Find the type of an exported function of a parsed module.
     */
    public static FunctionType exportType(WasmModule module, String name) {
        ExportSection exports = module.exportSection();
        for (int i = 0; i < exports.exportCount(); i++) {
            Export export = exports.getExport(i);
            if (export.exportType() == ExternalType.FUNCTION && export.name().equals(name)) {
                int index = (int) export.index() - module.importSection().count(ExternalType.FUNCTION);
                return module.typeSection().getType(module.functionSection().getFunctionType(index));
            }
        }
        throw new IllegalArgumentException("no exported function " + name);
    }

    private static Number[] decode(List<ValType> types, long[] raw) {
        Number[] values = new Number[types.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = decode(types.get(i), raw[i]);
        }
        return values;
    }

    static ValType valType(io.github.sigwasm.core.wasm.ValType type) {
        switch (type) {
            case I32:
                return ValType.I32;
            case I64:
                return ValType.I64;
            case F32:
                return ValType.F32;
            case F64:
                return ValType.F64;
            default:
                throw new IllegalArgumentException("unexpected value type " + type);
        }
    }

    static io.github.sigwasm.core.wasm.ValType valType(ValType type) {
        if (type.equals(ValType.I32)) return io.github.sigwasm.core.wasm.ValType.I32;
        if (type.equals(ValType.I64)) return io.github.sigwasm.core.wasm.ValType.I64;
        if (type.equals(ValType.F32)) return io.github.sigwasm.core.wasm.ValType.F32;
        if (type.equals(ValType.F64)) return io.github.sigwasm.core.wasm.ValType.F64;
        throw new IllegalArgumentException("unexpected value type " + type);
    }

    static Number decode(ValType type, long raw) {
        if (type.equals(ValType.I32)) return (int) raw;
        if (type.equals(ValType.I64)) return raw;
        if (type.equals(ValType.F32)) return Float.intBitsToFloat((int) raw);
        if (type.equals(ValType.F64)) return Double.longBitsToDouble(raw);
        throw new IllegalArgumentException("unexpected value type " + type);
    }

    static long encode(ValType type, Number value) {
        if (type.equals(ValType.I32)) return value.intValue();
        if (type.equals(ValType.I64)) return value.longValue();
        if (type.equals(ValType.F32)) return Float.floatToRawIntBits(value.floatValue()) & 0xFFFFFFFFL;
        if (type.equals(ValType.F64)) return Double.doubleToRawLongBits(value.doubleValue());
        throw new IllegalArgumentException("unexpected value type " + type);
    }
}
