package io.github.sigwasm.core.signal;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A read-only view of the signals created in a session.
 */
public interface SignalRegistry {
    /**
     * List the signals, in creation order.
     *
     * @return The signals.
     */
    List<Signal> listSignals();

    /**
     * Find the signal a getter or setter belongs to, by identity.
     *
     * @param accessor The accessor, or any other object.
     * @return The id of the signal, or null if {@code accessor} is not an accessor of a signal in this registry.
     */
    @Nullable
    Long identityOf(Object accessor);
}
