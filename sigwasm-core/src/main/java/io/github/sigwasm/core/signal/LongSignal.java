package io.github.sigwasm.core.signal;

import org.jetbrains.annotations.NotNull;

/**
 * A signal holding a {@code long}.
 */
public final class LongSignal extends Signal {
    private final long initial;
    private long value;
    private final Getter getter;
    private final Setter setter;

    LongSignal(long id, long initial) {
        super(id, SignalType.I64);
        this.initial = initial;
        this.value = initial;
        getter = () -> value;
        setter = v -> value = v;
    }

    @NotNull
    @Override
    public Long getInitialValue() {
        return initial;
    }

    @NotNull
    @Override
    public Long getValue() {
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
     * The getter of a {@link LongSignal}.
     */
    @FunctionalInterface
    public interface Getter extends SignalGetter {
        /**
         * Read the signal.
         *
         * @return The current value.
         */
        long get();

        @Override
        default Object value() {
            return get();
        }
    }

    /**
     * The setter of a {@link LongSignal}.
     */
    @FunctionalInterface
    public interface Setter extends SignalSetter {
        /**
         * Write the signal.
         *
         * @param value The new value.
         */
        void set(long value);
    }
}
