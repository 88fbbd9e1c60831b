package io.github.sigwasm.api.events;

import io.github.sigwasm.core.assemble.CompilerOptions;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when building the {@link CompilerOptions} of a compilation, before the component is analyzed.
 */
public class ModifyOptionsEvent implements ComponentCompileEvent {
    /**
     * The options builder.
     */
    @NotNull
    public CompilerOptions.Builder optionsBuilder;

    public ModifyOptionsEvent(@NotNull CompilerOptions.Builder optionsBuilder) {
        this.optionsBuilder = optionsBuilder;
    }
}
