package io.github.sigwasm.test;

import io.github.sigwasm.core.dom.Component;
import io.github.sigwasm.core.signal.DoubleSignal;
import io.github.sigwasm.core.signal.IntSignal;
import io.github.sigwasm.core.signal.LongSignal;
import org.junit.jupiter.api.Test;

import java.util.function.IntBinaryOperator;

import static io.github.sigwasm.core.dom.Html.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks lowered handlers by running them on every combination of inputs.
 */
public class ControlFlowLoweringTest {
    interface Expected {
        int apply(int a, int b, int c);
    }

    static void check(Utils.HandlerFactory factory, Expected expected) {
        DomHost vm = Utils.run(Utils.abcr(factory));
        for (int a = 0; a < 3; a++) {
            for (int b = 0; b < 3; b++) {
                for (int c = 0; c < 3; c++) {
                    vm.invoke("set_signal_1", a);
                    vm.invoke("set_signal_2", b);
                    vm.invoke("set_signal_3", c);
                    vm.invoke("set_signal_4", 0);
                    vm.invoke("handler_1");
                    assertEquals(expected.apply(a, b, c), vm.signal(4).intValue(),
                            "a=" + a + ", b=" + b + ", c=" + c);
                }
            }
        }
    }

    static void check2(Utils.HandlerFactory factory, IntBinaryOperator expected) {
        check(factory, (a, b, c) -> expected.applyAsInt(a, b));
    }

    @Test
    void testAndChain() {
        check((a, b, c, r, setR) -> () -> {
            if (a.get() != 0 && a.get() == b.get() && a.get() == c.get()) setR.set(1);
        }, (a, b, c) -> a != 0 && a == b && a == c ? 1 : 0);
    }

    @Test
    void testOrChain() {
        check((a, b, c, r, setR) -> () -> {
            if (a.get() == 2 || b.get() == 2 || c.get() == 2) setR.set(1);
        }, (a, b, c) -> a == 2 || b == 2 || c == 2 ? 1 : 0);
    }

    @Test
    void testSequentialIfs() {
        check((a, b, c, r, setR) -> () -> {
            if (a.get() > 0) setR.set(r.get() + 1);
            if (b.get() > 1) setR.set(r.get() + 10);
            if (c.get() < 1) setR.set(r.get() + 100);
        }, (a, b, c) -> (a > 0 ? 1 : 0) + (b > 1 ? 10 : 0) + (c < 1 ? 100 : 0));
    }

    @Test
    void testEarlyReturn() {
        check((a, b, c, r, setR) -> () -> {
            if (a.get() == 0) return;
            setR.set(5);
            if (b.get() == c.get()) return;
            setR.set(7);
        }, (a, b, c) -> a == 0 ? 0 : b == c ? 5 : 7);
    }

    @Test
    void testIfElseWithAnd() {
        check2((a, b, c, r, setR) -> () -> {
            if (a.get() > 0 && b.get() > 0) {
                setR.set(1);
            } else {
                setR.set(2);
            }
        }, (a, b) -> a > 0 && b > 0 ? 1 : 2);
    }

    @Test
    void testIfElseWithOr() {
        check2((a, b, c, r, setR) -> () -> {
            if (a.get() > 1 || b.get() < 1) {
                setR.set(1);
            } else {
                setR.set(2);
            }
        }, (a, b) -> a > 1 || b < 1 ? 1 : 2);
    }

    @Test
    void testElseIf() {
        check((a, b, c, r, setR) -> () -> {
            if (a.get() == b.get()) {
                setR.set(1);
            } else if (a.get() == c.get()) {
                setR.set(2);
            } else {
                setR.set(3);
            }
        }, (a, b, c) -> a == b ? 1 : a == c ? 2 : 3);
    }

    @Test
    void testTernary() {
        check2((a, b, c, r, setR) -> () -> setR.set(a.get() > b.get() ? a.get() : b.get()),
                Math::max);
    }

    @Test
    void testNestedTernary() {
        check((a, b, c, r, setR) -> () -> setR.set(a.get() == 0 ? b.get() : c.get() == 0 ? 10 : 20),
                (a, b, c) -> a == 0 ? b : c == 0 ? 10 : 20);
    }

    @Test
    void testLocals() {
        check((a, b, c, r, setR) -> () -> {
            int sum = a.get();
            if (b.get() > 0) sum = b.get() * 3;
            if (c.get() > 0) sum = sum * 2;
            setR.set(sum);
        }, (a, b, c) -> (b > 0 ? b * 3 : a) * (c > 0 ? 2 : 1));
    }

    @Test
    void testLongCompare() {
        Component component = signals -> {
            LongSignal big = signals.longSignal(0);
            IntSignal r = signals.intSignal(0);
            LongSignal.Getter getBig = big.getter();
            IntSignal.Setter setR = r.setter();
            return button(onClick(() -> {
                if (getBig.get() > 5_000_000_000L) setR.set(1);
                else setR.set(2);
            }));
        };
        DomHost vm = Utils.run(component);
        vm.invoke("handler_1");
        assertEquals(2, vm.signal(2).intValue());
        vm.invoke("set_signal_1", 6_000_000_000L);
        vm.invoke("handler_1");
        assertEquals(1, vm.signal(2).intValue());
    }

    @Test
    void testDoubleCompare() {
        Component component = signals -> {
            DoubleSignal level = signals.doubleSignal(0.25);
            IntSignal r = signals.intSignal(0);
            DoubleSignal.Getter getLevel = level.getter();
            IntSignal.Setter setR = r.setter();
            return button(onClick(() -> {
                if (getLevel.get() < 0.5) setR.set(1);
                else setR.set(2);
            }));
        };
        DomHost vm = Utils.run(component);
        vm.invoke("handler_1");
        assertEquals(1, vm.signal(2).intValue());
        vm.invoke("set_signal_1", 0.75);
        vm.invoke("handler_1");
        assertEquals(2, vm.signal(2).intValue());
        // NaN compares false, so the else branch runs
        vm.invoke("set_signal_1", Double.NaN);
        vm.invoke("set_signal_2", 0);
        vm.invoke("handler_1");
        assertEquals(2, vm.signal(2).intValue());
    }

    @Test
    void testDoubleArithmetic() {
        Component component = signals -> {
            DoubleSignal level = signals.doubleSignal(1.5);
            DoubleSignal.Getter getLevel = level.getter();
            DoubleSignal.Setter setLevel = level.setter();
            return div(p(getLevel), button(onClick(() -> setLevel.set(getLevel.get() * 2))));
        };
        DomHost vm = Utils.run(component);
        assertEquals(1.5, vm.text(2).doubleValue());
        vm.invoke("handler_1");
        assertEquals(3.0, vm.signal(1).doubleValue());
        assertEquals(3.0, vm.text(2).doubleValue());
    }
}
