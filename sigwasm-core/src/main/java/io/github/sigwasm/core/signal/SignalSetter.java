package io.github.sigwasm.core.signal;

/**
 * The setter of a signal, of any type.
 */
public interface SignalSetter extends SignalAccessor {
}
