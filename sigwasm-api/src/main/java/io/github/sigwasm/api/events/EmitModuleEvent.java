package io.github.sigwasm.api.events;

import io.github.sigwasm.api.CompiledComponent;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a compiled component should be emitted.
 */
public class EmitModuleEvent implements ComponentCompileEvent {
    /**
     * The name outputs should be written under.
     */
    @NotNull
    public String name;
    /**
     * The compiled component.
     */
    @NotNull
    public CompiledComponent component;
    private boolean cancelled = false;

    public EmitModuleEvent(@NotNull String name, @NotNull CompiledComponent component) {
        this.name = name;
        this.component = component;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Stop the component from being emitted to the listeners after this one.
     */
    public void cancel() {
        cancelled = true;
    }
}
