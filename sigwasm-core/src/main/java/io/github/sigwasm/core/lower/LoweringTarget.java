package io.github.sigwasm.core.lower;

import io.github.sigwasm.core.code.CodeNode;
import io.github.sigwasm.core.ops.HandlerOps;

import java.util.List;

/**
 * How signal accesses and handler exits are lowered, which depends on where the module keeps its signals.
 */
public interface LoweringTarget {
    /**
     * Emit a read of a signal, leaving its value on the stack as the type of its Java getter.
     *
     * @param signalId The signal.
     * @param out      The code to append to.
     */
    void emitRead(long signalId, List<CodeNode> out);

    /**
     * Emit a write of a signal, consuming a value of the type of its Java setter.
     *
     * @param signalId The signal.
     * @param out      The code to append to.
     */
    void emitWrite(long signalId, List<CodeNode> out);

    /**
     * Emit the code that runs whenever the handler exits, with an empty stack.
     *
     * @param ops The handler.
     * @param out The code to append to.
     */
    void emitEpilogue(HandlerOps ops, List<CodeNode> out);
}
