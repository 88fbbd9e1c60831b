package io.github.sigwasm.core.signal;

import org.jetbrains.annotations.NotNull;

/**
 * A signal holding a {@code float}.
 */
public final class FloatSignal extends Signal {
    private final float initial;
    private float value;
    private final Getter getter;
    private final Setter setter;

    FloatSignal(long id, float initial) {
        super(id, SignalType.F32);
        this.initial = initial;
        this.value = initial;
        getter = () -> value;
        setter = v -> value = v;
    }

    @NotNull
    @Override
    public Float getInitialValue() {
        return initial;
    }

    @NotNull
    @Override
    public Float getValue() {
        return value;
    }

    @Override
    public Getter getter() {
        return getter;
    }

    @Override
    public Setter setter() {
        return setter;
    }

    /**
     * The getter of a {@link FloatSignal}.
     */
    @FunctionalInterface
    public interface Getter extends SignalGetter {
        /**
         * Read the signal.
         *
         * @return The current value.
         */
        float get();

        @Override
        default Object value() {
            return get();
        }
    }

    /**
     * The setter of a {@link FloatSignal}.
     */
    @FunctionalInterface
    public interface Setter extends SignalSetter {
        /**
         * Write the signal.
         *
         * @param value The new value.
         */
        void set(float value);
    }
}
