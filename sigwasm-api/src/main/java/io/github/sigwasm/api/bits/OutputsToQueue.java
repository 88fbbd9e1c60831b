package io.github.sigwasm.api.bits;

import io.github.sigwasm.api.CompiledComponent;
import io.github.sigwasm.api.SignalCompiler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * A bit which puts every emitted component on a queue, returned when it is added.
 */
public class OutputsToQueue implements Bit<BlockingQueue<CompiledComponent>> {
    @Override
    public BlockingQueue<CompiledComponent> addTo(SignalCompiler cc) {
        BlockingQueue<CompiledComponent> queue = new LinkedBlockingQueue<>();
        cc.lift().onEmit(evt -> queue.add(evt.component));
        return queue;
    }
}
