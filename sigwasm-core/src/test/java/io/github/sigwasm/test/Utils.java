package io.github.sigwasm.test;

import com.dylibso.chicory.wasm.Parser;
import com.dylibso.chicory.wasm.types.Global;
import com.dylibso.chicory.wasm.types.GlobalSection;
import com.dylibso.chicory.wasm.types.MutabilityType;
import io.github.sigwasm.core.analysis.AnalyzedHandler;
import io.github.sigwasm.core.analysis.ComponentAnalysis;
import io.github.sigwasm.core.analysis.ComponentAnalyzer;
import io.github.sigwasm.core.assemble.CompiledModule;
import io.github.sigwasm.core.assemble.CompilerOptions;
import io.github.sigwasm.core.assemble.ModuleAssembler;
import io.github.sigwasm.core.dom.Component;
import io.github.sigwasm.core.dom.Handler;
import io.github.sigwasm.core.ir.HandlerIRExtractor;
import io.github.sigwasm.core.ops.HandlerOps;
import io.github.sigwasm.core.ops.SemanticExtractor;
import io.github.sigwasm.core.signal.IntSignal;
import io.github.sigwasm.core.wasm.GlobalEntry;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

import static io.github.sigwasm.core.dom.Html.*;

public class Utils {
    /**
     * Builds a handler over three input signals and a result signal.
     */
    @FunctionalInterface
    public interface HandlerFactory {
        Handler make(IntSignal.Getter a, IntSignal.Getter b, IntSignal.Getter c,
                     IntSignal.Getter r, IntSignal.Setter setR);
    }

    /**
     * A component with int signals a, b, c and r (ids 1 to 4), r shown as text, and one button
     * running the handler (handler_1).
     */
    @NotNull
    public static Component abcr(HandlerFactory factory) {
        return signals -> {
            IntSignal a = signals.intSignal(0);
            IntSignal b = signals.intSignal(0);
            IntSignal c = signals.intSignal(0);
            IntSignal r = signals.intSignal(0);
            return div(
                    p(r.getter()),
                    button(onClick(factory.make(a.getter(), b.getter(), c.getter(), r.getter(), r.setter())), "go")
            );
        };
    }

    @NotNull
    public static CompiledModule compile(Component component) {
        return compile(component, CompilerOptions.DEFAULT);
    }

    @NotNull
    public static CompiledModule compile(Component component, CompilerOptions options) {
        return ComponentAnalyzer.INSTANCE
                .then(new ModuleAssembler(options))
                .run(component);
    }

    @NotNull
    public static DomHost run(Component component) {
        DomHost vm = new DomHost(compile(component).getBytes());
        vm.invoke("init");
        return vm;
    }

    /**
     * Decode the globals of an encoded module with Chicory.
     */
    @NotNull
    public static List<GlobalEntry> globals(byte[] bytes) {
        GlobalSection section = Parser.parse(bytes).globalSection();
        List<GlobalEntry> globals = new ArrayList<>();
        for (int i = 0; i < section.globalCount(); i++) {
            Global global = section.getGlobal(i);
            long raw = global.initInstructions().get(0).operands()[0];
            globals.add(new GlobalEntry(
                    DomHost.valType(global.valueType()),
                    global.mutabilityType() == MutabilityType.Var,
                    DomHost.decode(global.valueType(), raw)));
        }
        return globals;
    }

    /**
     * Extract the semantic ops of a handler.
     */
    @NotNull
    public static HandlerOps ops(Component component, int handlerId) {
        ComponentAnalysis analysis = ComponentAnalyzer.INSTANCE.run(component);
        AnalyzedHandler handler = analysis.getHandlers().get(handlerId - 1);
        return new HandlerIRExtractor(analysis)
                .then(SemanticExtractor.INSTANCE)
                .run(handler);
    }
}
