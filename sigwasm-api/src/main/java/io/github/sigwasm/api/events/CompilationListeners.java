package io.github.sigwasm.api.events;

import io.github.sigwasm.api.SignalCompiler;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Listeners that are added to every compilation a {@link SignalCompiler} runs, including ones
 * submitted after the listener was added.
 *
 * @see SignalCompiler#lift()
 */
public final class CompilationListeners {
    private final EventSupplier<CompilerEvent> compiler;

    public CompilationListeners(EventSupplier<CompilerEvent> compiler) {
        this.compiler = compiler;
    }

    /**
     * Listen to an event type on every compilation.
     *
     * @param eventClass The exact event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     * @return This, for chaining.
     */
    public <T extends ComponentCompileEvent> CompilationListeners listen(Class<T> eventClass,
                                                                         @NotNull Consumer<T> listener) {
        compiler.listen(RunComponentCompilationEvent.class, evt -> evt.compilation.listen(eventClass, listener));
        return this;
    }

    /**
     * Listen to every component that is emitted.
     *
     * @param listener The listener.
     * @return This, for chaining.
     */
    public CompilationListeners onEmit(@NotNull Consumer<EmitModuleEvent> listener) {
        return listen(EmitModuleEvent.class, listener);
    }
}
