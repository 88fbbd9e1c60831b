package io.github.sigwasm.core.analysis;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A signal displayed by an element, as its text or as an attribute.
 */
public final class Binding {
    public final long signalId;
    public final int elementKey;
    /**
     * The attribute, or null if the signal is displayed as text.
     */
    @Nullable
    public final String attribute;

    public Binding(long signalId, int elementKey, @Nullable String attribute) {
        this.signalId = signalId;
        this.elementKey = elementKey;
        this.attribute = attribute;
    }

    public boolean isText() {
        return attribute == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Binding binding = (Binding) o;
        return signalId == binding.signalId
                && elementKey == binding.elementKey
                && Objects.equals(attribute, binding.attribute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signalId, elementKey, attribute);
    }

    @Override
    public String toString() {
        return "signal_" + signalId + " -> @" + elementKey + (attribute == null ? " text" : " [" + attribute + "]");
    }
}
