package io.github.sigwasm.core.ops;

import java.util.Arrays;

/**
 * A reference to a value by the indices of the operations that may produce it.
 * <p>
 * A value with a single producer is an ordinary SSA value, and a value with several is a phi.
 */
public final class ValueRef {
    private final int[] producers;

    public ValueRef(int[] producers) {
        this.producers = producers.clone();
        Arrays.sort(this.producers);
    }

    public int[] getProducers() {
        return producers.clone();
    }

    public boolean isPhi() {
        return producers.length > 1;
    }

    /**
     * Get the single producer of this value.
     *
     * @return The index of the producing operation.
     * @throws IllegalStateException If this value is a phi.
     */
    public int single() {
        if (producers.length != 1) {
            throw new IllegalStateException("value has " + producers.length + " producers");
        }
        return producers[0];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ValueRef && Arrays.equals(producers, ((ValueRef) o).producers);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(producers);
    }

    @Override
    public String toString() {
        if (producers.length == 1) return "%" + producers[0];
        StringBuilder sb = new StringBuilder("phi(");
        for (int i = 0; i < producers.length; i++) {
            if (i != 0) sb.append(", ");
            sb.append('%').append(producers[i]);
        }
        return sb.append(')').toString();
    }
}
