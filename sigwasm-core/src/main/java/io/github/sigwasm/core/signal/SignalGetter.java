package io.github.sigwasm.core.signal;

/**
 * The getter of a signal, of any type.
 */
public interface SignalGetter extends SignalAccessor {
    /**
     * Get the current value, boxed.
     *
     * @return The value.
     */
    Object value();
}
