package io.github.sigwasm.api.events;

import io.github.sigwasm.api.ComponentCompilation;

/**
 * An event fired during the compilation of a single component.
 *
 * @see ComponentCompilation
 */
public interface ComponentCompileEvent {
}
