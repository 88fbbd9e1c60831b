package io.github.sigwasm.core.analysis;

import io.github.sigwasm.core.signal.Signal;
import io.github.sigwasm.core.signal.SignalType;

/**
 * A signal found by analysis: its id, declared type and initial value.
 */
public final class AnalyzedSignal {
    public final long id;
    public final SignalType type;
    /**
     * The initial value, boxed according to {@link #type}.
     */
    public final Object initialValue;

    public AnalyzedSignal(long id, SignalType type, Object initialValue) {
        this.id = id;
        this.type = type;
        this.initialValue = initialValue;
    }

    static AnalyzedSignal of(Signal signal) {
        return new AnalyzedSignal(signal.getId(), signal.getType(), signal.getInitialValue());
    }

    /**
     * Get the initial value as a number, with booleans as 0 or 1.
     *
     * @return The initial value.
     */
    public Number initialNumber() {
        if (initialValue instanceof Boolean) {
            return (Boolean) initialValue ? 1 : 0;
        }
        return (Number) initialValue;
    }

    @Override
    public String toString() {
        return "signal_" + id + ":" + type + "=" + initialValue;
    }
}
