package io.github.sigwasm.core.signal;

/**
 * A factory of signals, handed to components when they are rendered.
 */
public interface Signals {
    IntSignal intSignal(int initial);

    LongSignal longSignal(long initial);

    FloatSignal floatSignal(float initial);

    DoubleSignal doubleSignal(double initial);

    BoolSignal boolSignal(boolean initial);
}
