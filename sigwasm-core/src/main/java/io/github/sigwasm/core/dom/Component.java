package io.github.sigwasm.core.dom;

import io.github.sigwasm.core.signal.Signals;

/**
 * A component: a function from a signal factory to an output tree.
 */
@FunctionalInterface
public interface Component {
    /**
     * Render the component, creating any signals it needs.
     *
     * @param signals The signal factory.
     * @return The output tree.
     */
    Object render(Signals signals);
}
