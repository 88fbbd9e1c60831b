package io.github.sigwasm.core.signal;

import org.jetbrains.annotations.NotNull;

/**
 * A signal holding a {@code boolean}.
 */
public final class BoolSignal extends Signal {
    private final boolean initial;
    private boolean value;
    private final Getter getter;
    private final Setter setter;

    BoolSignal(long id, boolean initial) {
        super(id, SignalType.BOOL);
        this.initial = initial;
        this.value = initial;
        getter = () -> value;
        setter = v -> value = v;
    }

    @NotNull
    @Override
    public Boolean getInitialValue() {
        return initial;
    }

    @NotNull
    @Override
    public Boolean getValue() {
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
     * The getter of a {@link BoolSignal}.
     */
    @FunctionalInterface
    public interface Getter extends SignalGetter {
        /**
         * Read the signal.
         *
         * @return The current value.
         */
        boolean get();

        @Override
        default Object value() {
            return get();
        }
    }

    /**
     * The setter of a {@link BoolSignal}.
     */
    @FunctionalInterface
    public interface Setter extends SignalSetter {
        /**
         * Write the signal.
         *
         * @param value The new value.
         */
        void set(boolean value);
    }
}
