package io.github.sigwasm.core.assemble;

import io.github.sigwasm.core.analysis.AnalyzedHandler;
import io.github.sigwasm.core.analysis.ComponentAnalysis;
import io.github.sigwasm.core.analysis.InputBinding;
import io.github.sigwasm.core.code.CodeWriter;
import io.github.sigwasm.core.code.FunctionBody;
import io.github.sigwasm.core.code.Insns;
import io.github.sigwasm.core.code.StackVerifier;
import io.github.sigwasm.core.ir.HandlerIRExtractor;
import io.github.sigwasm.core.lower.ControlFlowLowering;
import io.github.sigwasm.core.ops.HandlerOps;
import io.github.sigwasm.core.ops.SemanticExtractor;
import io.github.sigwasm.core.ops.WriteKind;
import io.github.sigwasm.core.passes.IRPass;
import io.github.sigwasm.core.wasm.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Assembles the module of an analyzed component.
 * <p>
 * Functions are laid out as: the {@link HostImports}, then a getter and a setter per signal,
 * then one function per handler, then one per input binding, then {@code init}.
 * Globals are the signals, in creation order.
 */
public class ModuleAssembler implements IRPass<ComponentAnalysis, CompiledModule> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModuleAssembler.class);

    private static final ValType[] NO_PARAMS = {};

    private final CompilerOptions options;

    public ModuleAssembler(CompilerOptions options) {
        this.options = options;
    }

    public ModuleAssembler() {
        this(CompilerOptions.DEFAULT);
    }

    @Override
    public CompiledModule run(ComponentAnalysis analysis) {
        return assemble(analysis);
    }

    public CompiledModule assemble(ComponentAnalysis analysis) {
        WasmModule module = new WasmModule();
        HostImports.register(module, options.getImportModule());

        SignalSlots slots = new SignalSlots(analysis.getSignals(), options.getNumericPolicy());
        Map<Long, Integer> signalGlobals = new LinkedHashMap<>();
        for (SignalSlots.Slot slot : slots.all()) {
            int global = module.addGlobal(new GlobalEntry(slot.type, true, slot.initialValue()));
            if (global != slot.global) {
                throw new IllegalStateException("global of signal_" + slot.signal.id + " is " + global
                        + ", expected " + slot.global);
            }
            signalGlobals.put(slot.signal.id, global);
            if (options.isExportSignalGlobals()) {
                module.addExport("signal_" + slot.signal.id, ExportEntry.GLOBAL, global);
            }
        }

        DomUpdateTable updates = new DomUpdateTable(analysis);
        ModuleTarget target = new ModuleTarget(slots, updates);
        List<String> exports = new ArrayList<>();

        for (SignalSlots.Slot slot : slots.all()) {
            FunctionBody getter = new FunctionBody(FuncType.of(NO_PARAMS, slot.type));
            getter.body.add(Insns.globalGet(slot.global, slot.type));
            addFunction(module, exports, "get_signal_" + slot.signal.id, getter);

            FunctionBody setter = new FunctionBody(FuncType.of(new ValType[]{slot.type}));
            setter.body.add(Insns.localGet(0, slot.type));
            setter.body.add(Insns.globalSet(slot.global, slot.type));
            addFunction(module, exports, "set_signal_" + slot.signal.id, setter);
        }

        IRPass<AnalyzedHandler, HandlerOps> frontEnd = new HandlerIRExtractor(analysis)
                .then(SemanticExtractor.INSTANCE);
        ControlFlowLowering lowering = new ControlFlowLowering(target);
        Map<Integer, Map<Long, List<WriteKind>>> writeKinds = new LinkedHashMap<>();
        for (AnalyzedHandler handler : analysis.getHandlers()) {
            HandlerOps ops = frontEnd.run(handler);
            FunctionBody body = lowering.run(ops);
            addFunction(module, exports, "handler_" + handler.id, body);

            Map<Long, List<WriteKind>> kinds = new LinkedHashMap<>();
            for (long signalId : ops.getWrittenSignals()) {
                kinds.put(signalId, ops.getWriteKinds(signalId));
            }
            writeKinds.put(handler.id, kinds);
            LOGGER.debug("handler_{} writes {}", handler.id, kinds);
        }

        for (InputBinding input : analysis.getInputBindings()) {
            SignalSlots.Slot slot = slots.get(input.signalId);
            FunctionBody body = new FunctionBody(FuncType.of(new ValType[]{slot.type}));
            body.body.add(Insns.localGet(0, slot.type));
            body.body.add(Insns.globalSet(slot.global, slot.type));
            target.emitUpdates(input.signalId, input.elementKey, body.body);
            addFunction(module, exports, "input_handler_" + input.handlerId, body);
        }

        FunctionBody init = new FunctionBody(FuncType.VOID);
        for (SignalSlots.Slot slot : slots.all()) {
            target.emitTextUpdates(slot.signal.id, init.body);
        }
        addFunction(module, exports, "init", init);

        byte[] bytes = ModuleWriter.write(module);
        LOGGER.debug("assembled {} signals, {} handlers, {} input handlers into {} bytes",
                signalGlobals.size(), analysis.getHandlers().size(), analysis.getInputBindings().size(), bytes.length);
        return new CompiledModule(bytes, module, exports, signalGlobals, updates.getAttributeNames(), writeKinds);
    }

    private static void addFunction(WasmModule module, List<String> exports, String name, FunctionBody body) {
        new StackVerifier(name).run(body);
        int index = module.addFunction(body.type, CodeWriter.write(body));
        module.addExport(name, ExportEntry.FUNC, index);
        exports.add(name);
    }
}
