package io.github.sigwasm.api;

import io.github.sigwasm.api.events.*;
import io.github.sigwasm.core.analysis.ComponentAnalysis;
import io.github.sigwasm.core.analysis.ComponentAnalyzer;
import io.github.sigwasm.core.assemble.CompiledModule;
import io.github.sigwasm.core.assemble.CompilerOptions;
import io.github.sigwasm.core.assemble.ModuleAssembler;
import io.github.sigwasm.core.dom.Component;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Represents the compilation of a single component.
 * <p>
 * Compilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunComponentCompilationEvent} is fired on the {@link SignalCompiler compiler}.</li>
 *     <li>{@link ModifyOptionsEvent} is fired.</li>
 *     <li>The component is {@link ComponentAnalyzer analyzed} in a dry run.</li>
 *     <li>{@link AnalysisCompleteEvent} is fired.</li>
 *     <li>Every handler is compiled and the module is {@link ModuleAssembler assembled}.</li>
 *     <li>{@link EmitModuleEvent} is fired.</li>
 * </ol>
 * Any compilation error aborts the whole compilation, and nothing is emitted.
 */
public class ComponentCompilation extends EventSupplier<ComponentCompileEvent> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComponentCompilation.class);

    private final SignalCompiler cc;

    /**
     * The name outputs are written under.
     */
    @NotNull
    public String name;
    /**
     * The component being compiled.
     */
    @NotNull
    public Component component;

    ComponentCompilation(SignalCompiler cc, @NotNull String name, @NotNull Component component) {
        this.cc = cc;
        this.name = name;
        this.component = component;
    }

    /**
     * Run the compilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The compiled component.
     */
    public CompiledComponent run() {
        cc.dispatch(RunComponentCompilationEvent.class, new RunComponentCompilationEvent(this));
        CompilerOptions options = dispatch(ModifyOptionsEvent.class,
                new ModifyOptionsEvent(CompilerOptions.builder()))
                .optionsBuilder
                .build();

        ComponentAnalysis analysis = ComponentAnalyzer.INSTANCE.run(component);
        dispatch(AnalysisCompleteEvent.class, new AnalysisCompleteEvent(analysis));

        CompiledModule module = new ModuleAssembler(options).run(analysis);
        CompiledComponent compiled = new CompiledComponent(analysis, module, HydrationManifest.of(analysis));
        LOGGER.debug("compiled {} with {}: {} exports", name, options, module.getFunctionExports().size());

        dispatchUntil(EmitModuleEvent.class, new EmitModuleEvent(name, compiled), EmitModuleEvent::isCancelled);
        return compiled;
    }

    /**
     * Configure the options of this compilation, by {@link ModifyOptionsEvent modifying the options}.
     *
     * @param modifier The function to apply to the options builder.
     * @return This, for convenience.
     */
    public ComponentCompilation configure(Consumer<CompilerOptions.Builder> modifier) {
        listen(ModifyOptionsEvent.class, evt -> modifier.accept(evt.optionsBuilder));
        return this;
    }

    /**
     * Set the name outputs are written under.
     *
     * @param name The name.
     * @return This, for convenience.
     */
    public ComponentCompilation setName(String name) {
        this.name = name;
        return this;
    }
}
