package io.github.sigwasm.api.bits;

import io.github.sigwasm.api.SignalCompiler;

/**
 * Something that hooks into a {@link SignalCompiler}, usually to collect what it emits.
 *
 * @param <T> What {@link SignalCompiler#add(Bit)} hands back, such as a handle on the collected outputs.
 */
@FunctionalInterface
public interface Bit<T> {
    /**
     * Hook this into a compiler.
     *
     * @param cc The compiler.
     * @return The handle.
     */
    T addTo(SignalCompiler cc);
}
