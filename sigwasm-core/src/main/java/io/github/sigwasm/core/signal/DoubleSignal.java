package io.github.sigwasm.core.signal;

import org.jetbrains.annotations.NotNull;

/**
 * A signal holding a {@code double}.
 */
public final class DoubleSignal extends Signal {
    private final double initial;
    private double value;
    private final Getter getter;
    private final Setter setter;

    DoubleSignal(long id, double initial) {
        super(id, SignalType.F64);
        this.initial = initial;
        this.value = initial;
        getter = () -> value;
        setter = v -> value = v;
    }

    @NotNull
    @Override
    public Double getInitialValue() {
        return initial;
    }

    @NotNull
    @Override
    public Double getValue() {
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
     * The getter of a {@link DoubleSignal}.
     */
    @FunctionalInterface
    public interface Getter extends SignalGetter {
        /**
         * Read the signal.
         *
         * @return The current value.
         */
        double get();

        @Override
        default Object value() {
            return get();
        }
    }

    /**
     * The setter of a {@link DoubleSignal}.
     */
    @FunctionalInterface
    public interface Setter extends SignalSetter {
        /**
         * Write the signal.
         *
         * @param value The new value.
         */
        void set(double value);
    }
}
