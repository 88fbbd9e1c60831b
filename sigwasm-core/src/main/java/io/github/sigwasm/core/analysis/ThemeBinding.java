package io.github.sigwasm.core.analysis;

/**
 * A signal controlling the page's dark mode.
 */
public final class ThemeBinding {
    public final long signalId;

    public ThemeBinding(long signalId) {
        this.signalId = signalId;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ThemeBinding && ((ThemeBinding) o).signalId == signalId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(signalId);
    }

    @Override
    public String toString() {
        return "signal_" + signalId + " -> dark mode";
    }
}
