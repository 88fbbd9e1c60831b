package io.github.sigwasm.core.signal;

import org.jetbrains.annotations.NotNull;

/**
 * A typed mutable state cell with a unique id.
 * <p>
 * Signals are created through {@link Signals}, and each has exactly one {@link #getter()}
 * and one {@link #setter()} for its whole lifetime.
 */
public abstract class Signal {
    private final long id;
    private final SignalType type;

    protected Signal(long id, SignalType type) {
        this.id = id;
        this.type = type;
    }

    /**
     * Get the id of this signal, unique within the session that created it.
     *
     * @return The id.
     */
    public long getId() {
        return id;
    }

    /**
     * Get the declared type of this signal.
     *
     * @return The type.
     */
    public SignalType getType() {
        return type;
    }

    /**
     * Get the value this signal was created with, boxed.
     *
     * @return The initial value.
     */
    @NotNull
    public abstract Object getInitialValue();

    /**
     * Get the current value of this signal, boxed.
     *
     * @return The current value.
     */
    @NotNull
    public abstract Object getValue();

    /**
     * Get the getter of this signal.
     *
     * @return The getter.
     */
    public abstract SignalGetter getter();

    /**
     * Get the setter of this signal.
     *
     * @return The setter.
     */
    public abstract SignalSetter setter();

    @Override
    public String toString() {
        return "signal_" + id + ":" + type + "=" + getValue();
    }
}
