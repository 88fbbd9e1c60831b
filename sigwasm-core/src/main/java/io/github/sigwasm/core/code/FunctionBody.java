package io.github.sigwasm.core.code;

import io.github.sigwasm.core.wasm.FuncType;
import io.github.sigwasm.core.wasm.ValType;

import java.util.ArrayList;
import java.util.List;

/**
 * The body of a function being generated: its type, its locals, and its tree of code.
 */
public final class FunctionBody {
    public final FuncType type;
    /**
     * The types of declared locals, which are numbered after the parameters.
     */
    public final List<ValType> locals = new ArrayList<>();
    public final List<CodeNode> body = new ArrayList<>();

    public FunctionBody(FuncType type) {
        this.type = type;
    }

    /**
     * Declare a new local.
     *
     * @param local The type of the local.
     * @return The index of the local.
     */
    public int addLocal(ValType local) {
        locals.add(local);
        return type.params.size() + locals.size() - 1;
    }
}
