package io.github.sigwasm.core.ir;

import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;
import org.objectweb.asm.tree.analysis.SourceValue;

import java.util.*;

/**
 * The typed instructions of a handler, with its captured values traced to signals.
 * <p>
 * The instructions are those of the closure's implementation method. {@link #typeFrames} give the
 * type of every stack slot and local before each instruction, and {@link #sourceFrames} give the
 * instructions that may have produced each value, which serve as SSA value ids: a value with more than one
 * producer is a phi.
 */
public final class HandlerIR {
    public final int handlerId;
    public final Object closure;
    /**
     * The internal name of the class declaring the implementation method.
     */
    public final String owner;
    public final MethodNode method;
    /**
     * Frames of types, indexed like {@code method.instructions}; null for unreachable instructions.
     */
    public final Frame<BasicValue>[] typeFrames;
    /**
     * Frames of producers, indexed like {@code method.instructions}; null for unreachable instructions.
     */
    public final Frame<SourceValue>[] sourceFrames;
    public final List<CapturedValue> captured;

    private final Map<Integer, CapturedValue> bySlot = new HashMap<>();

    public HandlerIR(
            int handlerId,
            Object closure,
            String owner,
            MethodNode method,
            Frame<BasicValue>[] typeFrames,
            Frame<SourceValue>[] sourceFrames,
            List<CapturedValue> captured
    ) {
        this.handlerId = handlerId;
        this.closure = closure;
        this.owner = owner;
        this.method = method;
        this.typeFrames = typeFrames;
        this.sourceFrames = sourceFrames;
        this.captured = Collections.unmodifiableList(captured);
        for (CapturedValue value : captured) {
            bySlot.put(value.slot, value);
        }
    }

    /**
     * Get the captured value held in a local variable slot on entry.
     *
     * @param slot The slot.
     * @return The captured value, or null if the slot is not a parameter.
     */
    @Nullable
    public CapturedValue capturedAt(int slot) {
        return bySlot.get(slot);
    }

    /**
     * Get the number of local slots used by the captured values.
     *
     * @return The number of slots.
     */
    public int parameterSlots() {
        int slots = 0;
        for (CapturedValue value : captured) {
            slots = Math.max(slots, value.slot + value.type.getSize());
        }
        return slots;
    }

    /**
     * Map captured argument indices to the signals of captured getters.
     *
     * @return The map, in index order.
     */
    public Map<Integer, Long> capturedGetters() {
        return capturedOf(CapturedValue.Kind.GETTER);
    }

    /**
     * Map captured argument indices to the signals of captured setters.
     *
     * @return The map, in index order.
     */
    public Map<Integer, Long> capturedSetters() {
        return capturedOf(CapturedValue.Kind.SETTER);
    }

    private Map<Integer, Long> capturedOf(CapturedValue.Kind kind) {
        Map<Integer, Long> map = new TreeMap<>();
        for (CapturedValue value : captured) {
            if (value.kind == kind) map.put(value.index, value.signalId);
        }
        return map;
    }

    public String subject() {
        return "handler_" + handlerId;
    }
}
