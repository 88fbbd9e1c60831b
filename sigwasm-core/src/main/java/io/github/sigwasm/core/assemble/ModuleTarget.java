package io.github.sigwasm.core.assemble;

import io.github.sigwasm.core.code.CodeNode;
import io.github.sigwasm.core.code.Insns;
import io.github.sigwasm.core.lower.LoweringTarget;
import io.github.sigwasm.core.ops.HandlerOps;
import io.github.sigwasm.core.wasm.Opcodes;
import io.github.sigwasm.core.wasm.ValType;

import java.util.Collections;
import java.util.List;

/**
 * Lowers signal accesses to the globals of a module, and refreshes the page through host callbacks.
 */
public class ModuleTarget implements LoweringTarget {
    private final SignalSlots slots;
    private final DomUpdateTable updates;

    public ModuleTarget(SignalSlots slots, DomUpdateTable updates) {
        this.slots = slots;
        this.updates = updates;
    }

    @Override
    public void emitRead(long signalId, List<CodeNode> out) {
        slots.emitRead(signalId, out);
    }

    @Override
    public void emitWrite(long signalId, List<CodeNode> out) {
        slots.emitWrite(signalId, out);
    }

    /**
     * Refresh every binding of every signal the handler writes, once each.
     */
    @Override
    public void emitEpilogue(HandlerOps ops, List<CodeNode> out) {
        for (long signalId : ops.getWrittenSignals()) {
            emitUpdates(signalId, -1, out);
        }
    }

    /**
     * Emit the updates of a signal.
     *
     * @param signalId The signal.
     * @param skipKey  An element whose updates to leave out, or -1.
     * @param out      The code to append to.
     */
    public void emitUpdates(long signalId, int skipKey, List<CodeNode> out) {
        for (DomUpdate update : updates.updatesOf(signalId)) {
            if (update.kind != DomUpdate.Kind.THEME && update.elementKey == skipKey) continue;
            emitUpdate(update, out);
        }
    }

    /**
     * Emit the text updates of a signal.
     *
     * @param signalId The signal.
     * @param out      The code to append to.
     */
    public void emitTextUpdates(long signalId, List<CodeNode> out) {
        for (DomUpdate update : updates.updatesOf(signalId)) {
            if (update.kind == DomUpdate.Kind.TEXT) emitUpdate(update, out);
        }
    }

    public void emitUpdate(DomUpdate update, List<CodeNode> out) {
        switch (update.kind) {
            case TEXT: {
                out.add(Insns.i32Const(update.elementKey));
                ValType type = slots.emitLoad(update.signalId, out);
                if (type == ValType.I32) {
                    call(HostImports.UPDATE_TEXT_I32, out);
                } else {
                    toF64(type, out);
                    call(HostImports.UPDATE_TEXT_F64, out);
                }
                break;
            }
            case ATTR: {
                out.add(Insns.i32Const(update.elementKey));
                out.add(Insns.i32Const(update.attribute));
                ValType type = slots.emitLoad(update.signalId, out);
                if (type == ValType.I32) {
                    call(HostImports.UPDATE_ATTR, out);
                } else {
                    toF64(type, out);
                    call(HostImports.UPDATE_ATTR_F64, out);
                }
                break;
            }
            case VISIBLE: {
                out.add(Insns.i32Const(update.elementKey));
                ValType type = slots.emitLoad(update.signalId, out);
                Collections.addAll(out, Insns.nonZero(type));
                call(HostImports.SET_VISIBLE, out);
                break;
            }
            default: {
                ValType type = slots.emitLoad(update.signalId, out);
                Collections.addAll(out, Insns.nonZero(type));
                call(HostImports.SET_DARK_MODE, out);
            }
        }
    }

    private static void call(int hostImport, List<CodeNode> out) {
        // imports come first, so their function index is their import index
        out.add(Insns.call(hostImport, HostImports.type(hostImport)));
    }

    private static void toF64(ValType type, List<CodeNode> out) {
        switch (type) {
            case I64:
                out.add(Insns.op(Opcodes.F64_CONVERT_I64_S));
                break;
            case F32:
                out.add(Insns.op(Opcodes.F64_PROMOTE_F32));
                break;
            case I32:
                out.add(Insns.op(Opcodes.F64_CONVERT_I32_S));
                break;
            default:
                break;
        }
    }
}
