package io.github.sigwasm.core.signal;

import org.jetbrains.annotations.NotNull;

/**
 * A signal holding a {@code int}.
 */
public final class IntSignal extends Signal {
    private final int initial;
    private int value;
    private final Getter getter;
    private final Setter setter;

    IntSignal(long id, int initial) {
        super(id, SignalType.I32);
        this.initial = initial;
        this.value = initial;
        getter = () -> value;
        setter = v -> value = v;
    }

    @NotNull
    @Override
    public Integer getInitialValue() {
        return initial;
    }

    @NotNull
    @Override
    public Integer getValue() {
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
     * The getter of a {@link IntSignal}.
     */
    @FunctionalInterface
    public interface Getter extends SignalGetter {
        /**
         * Read the signal.
         *
         * @return The current value.
         */
        int get();

        @Override
        default Object value() {
            return get();
        }
    }

    /**
     * The setter of a {@link IntSignal}.
     */
    @FunctionalInterface
    public interface Setter extends SignalSetter {
        /**
         * Write the signal.
         *
         * @param value The new value.
         */
        void set(int value);
    }
}
