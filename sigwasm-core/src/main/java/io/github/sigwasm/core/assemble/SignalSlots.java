package io.github.sigwasm.core.assemble;

import io.github.sigwasm.core.UnknownSignalException;
import io.github.sigwasm.core.CompilationException;
import io.github.sigwasm.core.analysis.AnalyzedSignal;
import io.github.sigwasm.core.code.CodeNode;
import io.github.sigwasm.core.code.Insns;
import io.github.sigwasm.core.signal.SignalType;
import io.github.sigwasm.core.wasm.Opcodes;
import io.github.sigwasm.core.wasm.ValType;

import java.util.*;

/**
 * The globals that hold the signals of a module, one per signal in creation order.
 */
public final class SignalSlots {
    /**
     * Where one signal is stored.
     */
    public static final class Slot {
        public final AnalyzedSignal signal;
        /**
         * The type of the global.
         */
        public final ValType type;
        /**
         * The type of the signal's values as seen by handlers.
         */
        public final ValType valueType;
        public final int global;

        Slot(AnalyzedSignal signal, ValType type, ValType valueType, int global) {
            this.signal = signal;
            this.type = type;
            this.valueType = valueType;
            this.global = global;
        }

        public boolean isNarrowed() {
            return type != valueType;
        }

        /**
         * Get the initial value of the global.
         *
         * @return The value, as an instance matching {@link #type}.
         */
        public Number initialValue() {
            Number initial = signal.initialNumber();
            switch (type) {
                case I32:
                    return initial.intValue();
                case I64:
                    return initial.longValue();
                case F32:
                    return initial.floatValue();
                default:
                    return initial.doubleValue();
            }
        }
    }

    private final Map<Long, Slot> slots = new LinkedHashMap<>();

    public SignalSlots(List<AnalyzedSignal> signals, NumericPolicy policy) {
        int global = 0;
        for (AnalyzedSignal signal : signals) {
            ValType valueType = ValType.fromSignal(signal.type);
            ValType type = valueType;
            if (policy == NumericPolicy.NARROW_I64 && signal.type == SignalType.I64) {
                long initial = signal.initialNumber().longValue();
                if (initial == (int) initial) type = ValType.I32;
            }
            slots.put(signal.id, new Slot(signal, type, valueType, global++));
        }
    }

    public Slot get(long signalId) {
        Slot slot = slots.get(signalId);
        if (slot == null) {
            throw new UnknownSignalException(CompilationException.signal(signalId), "no global for signal");
        }
        return slot;
    }

    public Collection<Slot> all() {
        return Collections.unmodifiableCollection(slots.values());
    }

    /**
     * Emit a read of a signal's global, leaving the global's own type.
     *
     * @param signalId The signal.
     * @param out      The code to append to.
     * @return The type left on the stack.
     */
    public ValType emitLoad(long signalId, List<CodeNode> out) {
        Slot slot = get(signalId);
        out.add(Insns.globalGet(slot.global, slot.type));
        return slot.type;
    }

    /**
     * Emit a read of a signal, leaving its value type.
     *
     * @param signalId The signal.
     * @param out      The code to append to.
     */
    public void emitRead(long signalId, List<CodeNode> out) {
        Slot slot = get(signalId);
        out.add(Insns.globalGet(slot.global, slot.type));
        if (slot.isNarrowed()) out.add(Insns.op(Opcodes.I64_EXTEND_I32_S));
    }

    /**
     * Emit a write of a signal, consuming its value type.
     *
     * @param signalId The signal.
     * @param out      The code to append to.
     */
    public void emitWrite(long signalId, List<CodeNode> out) {
        Slot slot = get(signalId);
        if (slot.isNarrowed()) out.add(Insns.op(Opcodes.I32_WRAP_I64));
        out.add(Insns.globalSet(slot.global, slot.type));
    }
}
