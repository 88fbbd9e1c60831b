package io.github.sigwasm.test;

import io.github.sigwasm.core.UnsupportedOpException;
import io.github.sigwasm.core.dom.Component;
import io.github.sigwasm.core.ops.HandlerOps;
import io.github.sigwasm.core.ops.SemanticOp;
import io.github.sigwasm.core.ops.SemanticOpKind;
import io.github.sigwasm.core.ops.WriteKind;
import io.github.sigwasm.core.signal.BoolSignal;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.sigwasm.core.dom.Html.*;
import static org.junit.jupiter.api.Assertions.*;

public class SemanticExtractorTest {
    static HandlerOps ops(Utils.HandlerFactory factory) {
        return Utils.ops(Utils.abcr(factory), 1);
    }

    @Test
    void testIncrementDecrement() {
        HandlerOps ops = ops((a, b, c, r, setR) -> () -> {
            setR.set(r.get() + 1);
            setR.set(r.get() - 1);
            setR.set(1 + r.get());
            setR.set(r.get() + -1);
        });
        assertEquals(Collections.singletonList(4L), ops.getWrittenSignals());
        assertEquals(Arrays.asList(WriteKind.INCREMENT, WriteKind.DECREMENT, WriteKind.INCREMENT, WriteKind.DECREMENT),
                ops.getWriteKinds(4));
    }

    @Test
    void testArithmeticKinds() {
        HandlerOps ops = ops((a, b, c, r, setR) -> () -> {
            setR.set(r.get() + 5);
            setR.set(r.get() - 3);
            setR.set(r.get() * 2);
            setR.set(7);
            setR.set(a.get() + 1);
            setR.set(10 - r.get());
        });
        assertEquals(Arrays.asList(WriteKind.ADD, WriteKind.SUB, WriteKind.MUL, WriteKind.SET,
                WriteKind.COMPUTED, WriteKind.COMPUTED), ops.getWriteKinds(4));
    }

    @Test
    void testToggle() {
        HandlerOps ops = ops((a, b, c, r, setR) -> () -> setR.set(r.get() == 0 ? 1 : 0));
        assertEquals(Collections.singletonList(WriteKind.TOGGLE), ops.getWriteKinds(4));

        HandlerOps backwards = ops((a, b, c, r, setR) -> () -> setR.set(r.get() != 0 ? 0 : 1));
        assertEquals(Collections.singletonList(WriteKind.TOGGLE), backwards.getWriteKinds(4));

        HandlerOps notToggle = ops((a, b, c, r, setR) -> () -> setR.set(r.get() == 0 ? 2 : 0));
        assertEquals(Collections.singletonList(WriteKind.COMPUTED), notToggle.getWriteKinds(4));
    }

    @Test
    void testBooleanToggle() {
        Component component = signals -> {
            BoolSignal dark = signals.boolSignal(false);
            BoolSignal.Getter isDark = dark.getter();
            BoolSignal.Setter setDark = dark.setter();
            return button(darkMode(isDark), onClick(() -> setDark.set(!isDark.get())));
        };
        HandlerOps ops = Utils.ops(component, 1);
        assertEquals(Collections.singletonList(WriteKind.TOGGLE), ops.getWriteKinds(1));
    }

    @Test
    void testReadsAndBranches() {
        HandlerOps ops = ops((a, b, c, r, setR) -> () -> {
            if (a.get() > b.get()) setR.set(1);
        });
        int reads = 0;
        int branches = 0;
        for (SemanticOp op : ops.getOps()) {
            if (op.kind == SemanticOpKind.READ) reads++;
            if (op.kind == SemanticOpKind.BRANCH) {
                branches++;
                assertEquals(2, op.inputs.size());
                assertTrue(op.target > op.index);
            }
        }
        assertEquals(2, reads);
        assertEquals(1, branches);
    }

    @Test
    void testRejectsSignalArithmetic() {
        UnsupportedOpException e = assertThrows(UnsupportedOpException.class,
                () -> ops((a, b, c, r, setR) -> () -> setR.set(a.get() + b.get())));
        assertEquals("handler_1", e.getSubject());
        assertTrue(e.getInsnIndex() >= 0);
    }

    @Test
    void testRejectsLoop() {
        assertThrows(UnsupportedOpException.class, () -> ops((a, b, c, r, setR) -> () -> {
            while (r.get() < 10) {
                setR.set(r.get() + 1);
            }
        }));
    }

    @Test
    void testRejectsOtherCalls() {
        assertThrows(UnsupportedOpException.class,
                () -> ops((a, b, c, r, setR) -> () -> setR.set(Math.abs(a.get()))));
    }

    @Test
    void testRejectsUnsupportedInstruction() {
        assertThrows(UnsupportedOpException.class,
                () -> ops((a, b, c, r, setR) -> () -> setR.set(a.get() / 2)));
    }

    @Test
    void testStackHeightsExcludeAccessors() {
        HandlerOps ops = ops((a, b, c, r, setR) -> () -> setR.set(3));
        for (SemanticOp op : ops.getOps()) {
            if (op.kind == SemanticOpKind.WRITE) {
                // only the constant is on the wasm stack
                assertEquals(1, ops.height(op.index));
            }
        }
    }
}
