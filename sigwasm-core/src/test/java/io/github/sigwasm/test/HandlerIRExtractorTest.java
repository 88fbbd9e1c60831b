package io.github.sigwasm.test;

import io.github.sigwasm.core.IRExtractionException;
import io.github.sigwasm.core.UnknownSignalException;
import io.github.sigwasm.core.analysis.ComponentAnalysis;
import io.github.sigwasm.core.analysis.ComponentAnalyzer;
import io.github.sigwasm.core.dom.Component;
import io.github.sigwasm.core.dom.Handler;
import io.github.sigwasm.core.ir.CapturedValue;
import io.github.sigwasm.core.ir.HandlerIR;
import io.github.sigwasm.core.ir.HandlerIRExtractor;
import io.github.sigwasm.core.signal.AnalysisSession;
import io.github.sigwasm.core.signal.IntSignal;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static io.github.sigwasm.core.dom.Html.*;
import static org.junit.jupiter.api.Assertions.*;

public class HandlerIRExtractorTest {
    private int clicks;

    static Handler addStep(IntSignal.Getter get, IntSignal.Setter set, int step) {
        return () -> set.set(get.get() + step);
    }

    static HandlerIR extract(Component component) {
        ComponentAnalysis analysis = ComponentAnalyzer.INSTANCE.run(component);
        return new HandlerIRExtractor(analysis).run(analysis.getHandlers().get(0));
    }

    @Test
    void testCapturedAccessors() {
        HandlerIR ir = extract(Utils.abcr((a, b, c, r, setR) -> () -> setR.set(a.get() + 1)));
        assertEquals(1, ir.handlerId);
        assertEquals("handler_1", ir.subject());
        assertEquals(2, ir.captured.size());
        assertEquals(1, ir.capturedGetters().size());
        assertEquals(Long.valueOf(1), ir.capturedGetters().values().iterator().next());
        assertEquals(1, ir.capturedSetters().size());
        assertEquals(Long.valueOf(4), ir.capturedSetters().values().iterator().next());
        assertEquals(ir.method.instructions.size(), ir.typeFrames.length);
        assertEquals(ir.method.instructions.size(), ir.sourceFrames.length);
    }

    @Test
    void testCapturedConstant() {
        HandlerIR ir = extract(signals -> {
            IntSignal count = signals.intSignal(0);
            return button(onClick(addStep(count.getter(), count.setter(), 5)), count.getter());
        });
        CapturedValue step = null;
        for (CapturedValue value : ir.captured) {
            if (value.kind == CapturedValue.Kind.CONSTANT) step = value;
        }
        assertNotNull(step);
        assertEquals(5, step.constant);
        assertSame(step, ir.capturedAt(step.slot));
    }

    @Test
    void testRejectsCapturedObject() {
        AtomicInteger counter = new AtomicInteger();
        assertThrows(IRExtractionException.class, () -> extract(signals -> {
            IntSignal count = signals.intSignal(0);
            IntSignal.Setter set = count.setter();
            return button(onClick(() -> set.set(counter.incrementAndGet())));
        }));
    }

    @Test
    void testRejectsThis() {
        assertThrows(IRExtractionException.class, () -> extract(signals -> {
            IntSignal count = signals.intSignal(0);
            IntSignal.Setter set = count.setter();
            return button(onClick(() -> set.set(clicks)));
        }));
    }

    @Test
    void testRejectsNonSerializable() {
        Runnable runnable = () -> {
        };
        assertThrows(IRExtractionException.class, () -> extract(signals -> button(attr("on_click", runnable))));
    }

    @Test
    void testRejectsForeignSignal() {
        IntSignal foreign;
        try (AnalysisSession other = new AnalysisSession()) {
            foreign = other.intSignal(0);
        }
        IntSignal.Getter get = foreign.getter();
        UnknownSignalException e = assertThrows(UnknownSignalException.class, () -> extract(signals -> {
            IntSignal count = signals.intSignal(0);
            IntSignal.Setter set = count.setter();
            return button(onClick(() -> set.set(get.get())));
        }));
        assertEquals("handler_1", e.getSubject());
    }
}
