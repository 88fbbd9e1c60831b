package io.github.sigwasm.core.wasm;

import java.util.Collections;
import java.util.List;

/**
 * The code of a defined function: its locals and its encoded body.
 */
public final class CodeEntry {
    /**
     * The types of the declared locals, not including parameters.
     */
    public final List<ValType> locals;
    /**
     * The encoded expression, including the final {@code end}.
     */
    public final byte[] body;

    public CodeEntry(List<ValType> locals, byte[] body) {
        this.locals = Collections.unmodifiableList(locals);
        this.body = body;
    }
}
