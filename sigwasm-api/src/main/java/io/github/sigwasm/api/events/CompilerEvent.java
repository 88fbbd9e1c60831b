package io.github.sigwasm.api.events;

import io.github.sigwasm.api.SignalCompiler;

/**
 * An event fired on the {@link SignalCompiler} itself.
 */
public interface CompilerEvent {
}
