package io.github.sigwasm.core.analysis;

import java.util.Objects;

/**
 * A show wrapper whose visibility follows a signal.
 */
public final class ShowBinding {
    public final long signalId;
    public final int elementKey;
    public final boolean initialVisible;

    public ShowBinding(long signalId, int elementKey, boolean initialVisible) {
        this.signalId = signalId;
        this.elementKey = elementKey;
        this.initialVisible = initialVisible;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShowBinding that = (ShowBinding) o;
        return signalId == that.signalId && elementKey == that.elementKey && initialVisible == that.initialVisible;
    }

    @Override
    public int hashCode() {
        return Objects.hash(signalId, elementKey, initialVisible);
    }

    @Override
    public String toString() {
        return "signal_" + signalId + " -> show @" + elementKey;
    }
}
