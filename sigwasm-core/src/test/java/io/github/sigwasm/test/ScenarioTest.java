package io.github.sigwasm.test;

import io.github.sigwasm.core.IRExtractionException;
import io.github.sigwasm.core.assemble.CompiledModule;
import io.github.sigwasm.core.dom.Component;
import io.github.sigwasm.core.dom.Handler;
import io.github.sigwasm.core.ops.WriteKind;
import io.github.sigwasm.core.signal.IntSignal;
import io.github.sigwasm.core.signal.Signals;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.sigwasm.core.dom.Html.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Whole components, compiled and clicked through.
 */
public class ScenarioTest {
    static Object counter(Signals signals) {
        IntSignal count = signals.intSignal(0);
        IntSignal.Getter value = count.getter();
        IntSignal.Setter setValue = count.setter();
        return div(
                p(value),
                button(onClick(() -> setValue.set(value.get() + 1)), "+"),
                button(onClick(() -> setValue.set(value.get() - 1)), "-")
        );
    }

    @Test
    void testCounter() {
        DomHost vm = Utils.run(ScenarioTest::counter);
        assertEquals(0, vm.text(2));
        for (int i = 0; i < 3; i++) vm.invoke("handler_1");
        vm.invoke("handler_2");
        assertEquals(2, vm.signal(1));
        assertEquals(2, vm.text(2));
    }

    static Object toggle(Signals signals) {
        IntSignal on = signals.intSignal(0);
        IntSignal.Getter isOn = on.getter();
        IntSignal.Setter setOn = on.setter();
        return div(
                show(isOn, p("on")),
                button(onClick(() -> setOn.set(isOn.get() == 0 ? 1 : 0)), "toggle")
        );
    }

    @Test
    void testToggle() {
        CompiledModule compiled = Utils.compile(ScenarioTest::toggle);
        assertEquals(Collections.singletonMap(1L, Collections.singletonList(WriteKind.TOGGLE)),
                compiled.getWriteKinds(1));

        DomHost vm = new DomHost(compiled.getBytes());
        vm.invoke("init");
        vm.invoke("handler_1");
        assertEquals(1, vm.signal(1));
        assertEquals(Boolean.TRUE, vm.isVisible(2));
        vm.invoke("handler_1");
        assertEquals(0, vm.signal(1));
        assertEquals(Boolean.FALSE, vm.isVisible(2));
    }

    /**
     * A click on a square: if the game is still on and the square is empty, place the mark of the player
     * whose turn it is (turn 0 plays 1, turn 1 plays 2), check all eight lines, and pass the turn.
     */
    static Handler squareClick(IntSignal.Getter square, IntSignal.Setter setSquare,
                               IntSignal.Getter c0, IntSignal.Getter c1, IntSignal.Getter c2,
                               IntSignal.Getter c3, IntSignal.Getter c4, IntSignal.Getter c5,
                               IntSignal.Getter c6, IntSignal.Getter c7, IntSignal.Getter c8,
                               IntSignal.Getter turn, IntSignal.Setter setTurn,
                               IntSignal.Getter winner, IntSignal.Setter setWinner) {
        return () -> {
            if (winner.get() != 0 || square.get() != 0) return;
            int mark = turn.get() + 1;
            setSquare.set(mark);
            if ((c0.get() == mark && c1.get() == mark && c2.get() == mark)
                    || (c3.get() == mark && c4.get() == mark && c5.get() == mark)
                    || (c6.get() == mark && c7.get() == mark && c8.get() == mark)
                    || (c0.get() == mark && c3.get() == mark && c6.get() == mark)
                    || (c1.get() == mark && c4.get() == mark && c7.get() == mark)
                    || (c2.get() == mark && c5.get() == mark && c8.get() == mark)
                    || (c0.get() == mark && c4.get() == mark && c8.get() == mark)
                    || (c2.get() == mark && c4.get() == mark && c6.get() == mark)) {
                setWinner.set(mark);
            }
            setTurn.set(turn.get() == 0 ? 1 : 0);
        };
    }

    static Object ticTacToe(Signals signals) {
        IntSignal[] squares = new IntSignal[9];
        for (int i = 0; i < 9; i++) squares[i] = signals.intSignal(0);
        IntSignal turn = signals.intSignal(0);
        IntSignal winner = signals.intSignal(0);

        IntSignal.Getter[] board = new IntSignal.Getter[9];
        for (int i = 0; i < 9; i++) board[i] = squares[i].getter();
        List<Object> buttons = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            buttons.add(button(
                    onClick(squareClick(squares[i].getter(), squares[i].setter(),
                            board[0], board[1], board[2], board[3], board[4],
                            board[5], board[6], board[7], board[8],
                            turn.getter(), turn.setter(), winner.getter(), winner.setter())),
                    squares[i].getter()));
        }
        return div(div(buttons), p("Winner: ", winner.getter()));
    }

    private static List<Number> state(DomHost vm) {
        List<Number> state = new ArrayList<>();
        for (int id = 1; id <= 11; id++) state.add(vm.signal(id));
        return state;
    }

    @Test
    void testTicTacToe() {
        DomHost vm = Utils.run(ScenarioTest::ticTacToe);
        // X takes the top row while O plays the middle row
        int[] clicks = {0, 3, 1, 4, 2};
        for (int i = 0; i < clicks.length; i++) {
            assertEquals(0, vm.signal(11));
            vm.invoke("handler_" + (clicks[i] + 1));
        }
        // squares are signals 1 to 9, then turn and winner
        assertEquals(1, vm.signal(11));
        assertEquals(Arrays.asList(1, 1, 1, 2, 2, 0, 0, 0, 0, 1, 1), state(vm));
        // squares are buttons 3 to 11, the winner is shown in 12
        assertEquals(1, vm.text(12));
        assertEquals(1, vm.text(3));
        assertEquals(2, vm.text(6));

        List<Number> finished = state(vm);
        for (int square = 1; square <= 9; square++) {
            vm.invoke("handler_" + square);
            assertEquals(finished, state(vm), "after clicking square " + square);
        }
    }

    @Test
    void testTicTacToeDiagonal() {
        DomHost vm = Utils.run(ScenarioTest::ticTacToe);
        for (int square : new int[]{2, 0, 4, 1, 6}) {
            vm.invoke("handler_" + (square + 1));
        }
        assertEquals(1, vm.signal(11));
    }

    @Test
    void testTicTacToeOccupiedSquare() {
        DomHost vm = Utils.run(ScenarioTest::ticTacToe);
        vm.invoke("handler_5");
        vm.invoke("handler_5");
        assertEquals(1, vm.signal(5));
        assertEquals(1, vm.signal(10));
        assertEquals(0, vm.signal(11));
    }

    @Test
    void testRejectedHandler() {
        AtomicInteger counter = new AtomicInteger();
        Component component = signals -> {
            IntSignal count = signals.intSignal(0);
            IntSignal.Setter setCount = count.setter();
            return div(p(count.getter()), button(onClick(() -> setCount.set(counter.incrementAndGet()))));
        };
        CompiledModule[] result = new CompiledModule[1];
        IRExtractionException e = assertThrows(IRExtractionException.class,
                () -> result[0] = Utils.compile(component));
        assertEquals("handler_1", e.getSubject());
        assertNull(result[0]);
    }
}
