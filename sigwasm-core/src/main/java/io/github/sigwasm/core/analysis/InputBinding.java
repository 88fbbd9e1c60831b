package io.github.sigwasm.core.analysis;

import java.util.Objects;

/**
 * A two-way binding: a setter wired directly as the input handler of an {@code input} element.
 */
public final class InputBinding {
    public final long signalId;
    public final int elementKey;
    /**
     * The id of the input handler, shared with the numbering of {@link AnalyzedHandler}s.
     */
    public final int handlerId;
    /**
     * The {@code type} of the input element, {@code text} by default.
     */
    public final String valueKind;

    public InputBinding(long signalId, int elementKey, int handlerId, String valueKind) {
        this.signalId = signalId;
        this.elementKey = elementKey;
        this.handlerId = handlerId;
        this.valueKind = valueKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InputBinding that = (InputBinding) o;
        return signalId == that.signalId
                && elementKey == that.elementKey
                && handlerId == that.handlerId
                && valueKind.equals(that.valueKind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signalId, elementKey, handlerId, valueKind);
    }

    @Override
    public String toString() {
        return "input_handler_" + handlerId + ": @" + elementKey + " -> signal_" + signalId + " (" + valueKind + ")";
    }
}
