package io.github.sigwasm.api.events;

import io.github.sigwasm.api.ComponentCompilation;
import io.github.sigwasm.api.SignalCompiler;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a component compilation is started.
 *
 * @see SignalCompiler
 * @see ComponentCompilation
 */
public class RunComponentCompilationEvent implements CompilerEvent {
    /**
     * The component compilation.
     */
    @NotNull
    public ComponentCompilation compilation;

    public RunComponentCompilationEvent(@NotNull ComponentCompilation compilation) {
        this.compilation = compilation;
    }
}
