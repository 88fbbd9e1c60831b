package io.github.sigwasm.core.assemble;

import io.github.sigwasm.core.wasm.FuncType;
import io.github.sigwasm.core.wasm.ValType;
import io.github.sigwasm.core.wasm.WasmModule;

import static io.github.sigwasm.core.wasm.ValType.F64;
import static io.github.sigwasm.core.wasm.ValType.I32;

/**
 * The callbacks a module imports from its host to update the page.
 * <p>
 * They are always imported in this order, so their function indices are fixed.
 */
public final class HostImports {
    private HostImports() {
    }

    /**
     * {@code update_text_i32(key, value)}: show an integer as the text of an element.
     */
    public static final int UPDATE_TEXT_I32 = 0;
    /**
     * {@code update_text_f64(key, value)}: show a number as the text of an element.
     */
    public static final int UPDATE_TEXT_F64 = 1;
    /**
     * {@code update_attr(key, attribute, value)}: set an attribute, named by its index in the attribute table.
     */
    public static final int UPDATE_ATTR = 2;
    /**
     * {@code set_visible(key, visible)}: show or hide an element.
     */
    public static final int SET_VISIBLE = 3;
    /**
     * {@code set_dark_mode(enabled)}: switch the page theme.
     */
    public static final int SET_DARK_MODE = 4;
    /**
     * {@code update_attr_f64(key, attribute, value)}: set an attribute to a number.
     */
    public static final int UPDATE_ATTR_F64 = 5;

    public static final int COUNT = 6;

    private static final String[] NAMES = {
            "update_text_i32",
            "update_text_f64",
            "update_attr",
            "set_visible",
            "set_dark_mode",
            "update_attr_f64",
    };

    private static final FuncType[] TYPES = {
            FuncType.of(new ValType[]{I32, I32}),
            FuncType.of(new ValType[]{I32, F64}),
            FuncType.of(new ValType[]{I32, I32, I32}),
            FuncType.of(new ValType[]{I32, I32}),
            FuncType.of(new ValType[]{I32}),
            FuncType.of(new ValType[]{I32, I32, F64}),
    };

    public static String name(int index) {
        return NAMES[index];
    }

    public static FuncType type(int index) {
        return TYPES[index];
    }

    /**
     * Add the imports to a module that has no functions yet.
     *
     * @param module       The module.
     * @param importModule The module name to import from.
     */
    public static void register(WasmModule module, String importModule) {
        for (int i = 0; i < COUNT; i++) {
            module.addImport(importModule, NAMES[i], TYPES[i]);
        }
    }
}
