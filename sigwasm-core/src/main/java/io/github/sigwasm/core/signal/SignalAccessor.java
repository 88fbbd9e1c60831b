package io.github.sigwasm.core.signal;

/**
 * A getter or setter of a signal.
 * <p>
 * Accessors are compared by identity: each signal hands out exactly one getter and one setter,
 * and a captured accessor is traced back to its signal through that identity.
 */
public interface SignalAccessor {
}
