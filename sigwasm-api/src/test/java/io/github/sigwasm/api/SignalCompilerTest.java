package io.github.sigwasm.api;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.github.sigwasm.api.bits.OutputsToDirectory;
import io.github.sigwasm.api.events.*;
import io.github.sigwasm.core.UnsupportedOpException;
import io.github.sigwasm.core.assemble.NumericPolicy;
import io.github.sigwasm.core.dom.Component;
import io.github.sigwasm.core.signal.IntSignal;
import io.github.sigwasm.core.signal.LongSignal;
import io.github.sigwasm.core.signal.Signals;
import io.github.sigwasm.core.wasm.ValType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import static io.github.sigwasm.core.dom.Html.*;
import static org.junit.jupiter.api.Assertions.*;

public class SignalCompilerTest {
    public static Object counter(Signals signals) {
        IntSignal count = signals.intSignal(0);
        IntSignal.Getter value = count.getter();
        IntSignal.Setter setValue = count.setter();
        return div(
                p(value),
                button(onClick(() -> setValue.set(value.get() + 1)), "+"),
                input(attr("type", "number"), onInput(setValue))
        );
    }

    public static Component counterComponent() {
        return SignalCompilerTest::counter;
    }

    public static Object big(Signals signals) {
        LongSignal total = signals.longSignal(1);
        return p(total.getter());
    }

    @Test
    void testEventOrder() {
        SignalCompiler cc = new SignalCompiler();
        List<String> seen = new ArrayList<>();
        cc.listen(RunComponentCompilationEvent.class, evt -> seen.add("run " + evt.compilation.name));
        cc.lift().listen(ModifyOptionsEvent.class, evt -> seen.add("options"));
        cc.lift().listen(AnalysisCompleteEvent.class, evt ->
                seen.add("analysis " + evt.analysis.getSignals().size()));
        cc.lift().listen(EmitModuleEvent.class, evt -> seen.add("emit " + evt.name));

        CompiledComponent compiled = cc.submit("counter", SignalCompilerTest::counter).run();
        assertEquals(Arrays.asList("run counter", "options", "analysis 1", "emit counter"), seen);
        assertTrue(compiled.getHtml().startsWith("<div data-hk=\"1\">"), compiled.getHtml());
        assertArrayEquals(compiled.getModule().getBytes(), compiled.getWasm());
    }

    @Test
    void testCancelEmit() {
        SignalCompiler cc = new SignalCompiler();
        List<String> emitted = new ArrayList<>();
        cc.lift().listen(EmitModuleEvent.class, EmitModuleEvent::cancel);
        cc.lift().listen(EmitModuleEvent.class, evt -> emitted.add(evt.name));
        cc.compile(SignalCompilerTest::counter);
        assertTrue(emitted.isEmpty());
    }

    @Test
    void testConfigure() {
        SignalCompiler cc = new SignalCompiler();
        CompiledComponent exact = cc.submit(SignalCompilerTest::big).run();
        assertEquals(ValType.I64, exact.getModule().getModule().globals.get(0).type);

        CompiledComponent narrow = cc.submit(SignalCompilerTest::big)
                .configure(options -> options.numericPolicy(NumericPolicy.NARROW_I64))
                .run();
        assertEquals(ValType.I32, narrow.getModule().getModule().globals.get(0).type);
    }

    @Test
    void testOutputsAsQueue() {
        SignalCompiler cc = new SignalCompiler();
        BlockingQueue<CompiledComponent> queue = cc.outputsAsQueue();
        CompiledComponent compiled = cc.submit("a", SignalCompilerTest::counter).run();
        assertSame(compiled, queue.poll());
        assertNull(queue.poll());
    }

    @Test
    void testFailedCompilationEmitsNothing() {
        SignalCompiler cc = new SignalCompiler();
        BlockingQueue<CompiledComponent> queue = cc.outputsAsQueue();
        Component bad = signals -> {
            IntSignal a = signals.intSignal(1);
            IntSignal b = signals.intSignal(2);
            IntSignal.Getter getA = a.getter();
            IntSignal.Getter getB = b.getter();
            IntSignal.Setter setA = a.setter();
            return button(onClick(() -> setA.set(getA.get() * getB.get())));
        };
        assertThrows(UnsupportedOpException.class, () -> cc.compile(bad));
        assertTrue(queue.isEmpty());
    }

    @Test
    void testManifest() {
        HydrationManifest manifest = new SignalCompiler().compile(SignalCompilerTest::counter).getManifest();
        assertEquals(1, manifest.getEvents().size());
        HydrationManifest.EventEntry click = manifest.getEvents().get(0);
        assertEquals(3, click.elementKey);
        assertEquals("click", click.event);
        assertEquals("handler_1", click.export);

        assertEquals(1, manifest.getInputs().size());
        HydrationManifest.InputEntry input = manifest.getInputs().get(0);
        assertEquals(4, input.elementKey);
        assertEquals("number", input.valueKind);
        assertEquals("input_handler_2", input.export);

        String json = manifest.toJson();
        JsonObject root = JsonParser.parseString(json).getAsJsonObject();
        assertEquals("init", root.get("init").getAsString());
        JsonObject event = root.getAsJsonArray("events").get(0).getAsJsonObject();
        assertEquals(3, event.get("hk").getAsInt());
        assertEquals("click", event.get("event").getAsString());
        assertEquals("handler_1", event.get("export").getAsString());
        JsonObject inputJson = root.getAsJsonArray("inputs").get(0).getAsJsonObject();
        assertEquals(4, inputJson.get("hk").getAsInt());
        assertEquals("number", inputJson.get("kind").getAsString());
        assertEquals("input_handler_2", inputJson.get("export").getAsString());

        HydrationManifest read = HydrationManifest.fromJson(json);
        assertEquals(3, read.getEvents().get(0).elementKey);
        assertEquals("number", read.getInputs().get(0).valueKind);
        assertEquals(json, read.toJson());
    }

    @Test
    void testOutputsToDirectory(@TempDir Path dir) throws IOException {
        SignalCompiler cc = new SignalCompiler();
        cc.add(new OutputsToDirectory(dir));
        CompiledComponent compiled = cc.submit("counter", SignalCompilerTest::counter).run();

        assertArrayEquals(compiled.getWasm(), Files.readAllBytes(dir.resolve("counter.wasm")));
        assertEquals(compiled.getHtml(),
                new String(Files.readAllBytes(dir.resolve("counter.html")), StandardCharsets.UTF_8));
        assertEquals(compiled.getManifest().toJson(),
                new String(Files.readAllBytes(dir.resolve("counter.hydration.json")), StandardCharsets.UTF_8));
    }

    @Test
    void testCliWritesModule(@TempDir Path dir) throws IOException {
        Cli.main(new String[]{"-o", dir.toString(), SignalCompilerTest.class.getName() + "#counter"});
        byte[] wasm = Files.readAllBytes(dir.resolve("counter.wasm"));
        assertArrayEquals(new SignalCompiler().compile(SignalCompilerTest::counter).getWasm(), wasm);
        assertTrue(Files.exists(dir.resolve("counter.html")));
    }

    @Test
    void testResolve() throws ReflectiveOperationException {
        String className = SignalCompilerTest.class.getName();
        Component fromSignals = Cli.resolve(className, "counter");
        Component fromSupplier = Cli.resolve(className, "counterComponent");
        SignalCompiler cc = new SignalCompiler();
        assertArrayEquals(cc.compile(fromSignals).getWasm(), cc.compile(fromSupplier).getWasm());

        assertThrows(NoSuchMethodException.class, () -> Cli.resolve(className, "testResolve"));
        assertThrows(ClassNotFoundException.class, () -> Cli.resolve(className + "Missing", "counter"));
    }
}
