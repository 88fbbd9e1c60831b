package io.github.sigwasm.core.signal;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A scope in which signals are created and recorded.
 * <p>
 * Ids are handed out sequentially from 1, and getters and setters are recorded by identity,
 * so that separate sessions never interfere with each other.
 */
public class AnalysisSession implements Signals, SignalRegistry, AutoCloseable {
    private final List<Signal> signals = new ArrayList<>();
    private final Map<Object, Signal> getters = new IdentityHashMap<>();
    private final Map<Object, Signal> setters = new IdentityHashMap<>();
    private long nextId = 1;
    private boolean closed = false;

    private <T extends Signal> T record(T signal) {
        if (closed) {
            throw new IllegalStateException("cannot create a signal in a closed session");
        }
        signals.add(signal);
        getters.put(signal.getter(), signal);
        setters.put(signal.setter(), signal);
        return signal;
    }

    @Override
    public IntSignal intSignal(int initial) {
        return record(new IntSignal(nextId++, initial));
    }

    @Override
    public LongSignal longSignal(long initial) {
        return record(new LongSignal(nextId++, initial));
    }

    @Override
    public FloatSignal floatSignal(float initial) {
        return record(new FloatSignal(nextId++, initial));
    }

    @Override
    public DoubleSignal doubleSignal(double initial) {
        return record(new DoubleSignal(nextId++, initial));
    }

    @Override
    public BoolSignal boolSignal(boolean initial) {
        return record(new BoolSignal(nextId++, initial));
    }

    @Override
    public List<Signal> listSignals() {
        return Collections.unmodifiableList(signals);
    }

    @Nullable
    @Override
    public Long identityOf(Object accessor) {
        Signal signal = getters.get(accessor);
        if (signal == null) signal = setters.get(accessor);
        return signal == null ? null : signal.getId();
    }

    /**
     * Find the signal owning a getter, by identity.
     *
     * @param value Any value.
     * @return The signal, or null if {@code value} is not a getter of this session.
     */
    @Nullable
    public Signal getterOf(Object value) {
        return getters.get(value);
    }

    /**
     * Find the signal owning a setter, by identity.
     *
     * @param value Any value.
     * @return The signal, or null if {@code value} is not a setter of this session.
     */
    @Nullable
    public Signal setterOf(Object value) {
        return setters.get(value);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
