package io.github.sigwasm.api;

import io.github.sigwasm.api.bits.Bit;
import io.github.sigwasm.api.bits.OutputsToQueue;
import io.github.sigwasm.api.events.CompilationListeners;
import io.github.sigwasm.api.events.CompilerEvent;
import io.github.sigwasm.api.events.EventSupplier;
import io.github.sigwasm.core.dom.Component;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.BlockingQueue;

/**
 * The entrypoint for compiling components to WebAssembly.
 * <p>
 * Components are {@link #submit(String, Component) submitted} to get a {@link ComponentCompilation},
 * which is configured through events and then {@link ComponentCompilation#run() run}.
 */
public class SignalCompiler extends EventSupplier<CompilerEvent> {
    @Contract(pure = true)
    public ComponentCompilation submit(Component component) {
        return submit("component", component);
    }

    /**
     * Submit a component for compilation.
     *
     * @param name      The name outputs are written under.
     * @param component The component.
     * @return The compilation, which has not been run yet.
     */
    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    public ComponentCompilation submit(String name, Component component) {
        return new ComponentCompilation(this, name, component);
    }

    /**
     * Submit a component and run its compilation.
     *
     * @param component The component.
     * @return The compiled component.
     */
    public CompiledComponent compile(Component component) {
        return submit(component).run();
    }

    /**
     * Get a dispatcher that listens to events on every compilation run by this compiler.
     *
     * @return The dispatcher.
     */
    public CompilationListeners lift() {
        return new CompilationListeners(this);
    }

    public BlockingQueue<CompiledComponent> outputsAsQueue() {
        return add(new OutputsToQueue());
    }

    public <T> T add(Bit<T> bit) {
        return bit.addTo(this);
    }
}
