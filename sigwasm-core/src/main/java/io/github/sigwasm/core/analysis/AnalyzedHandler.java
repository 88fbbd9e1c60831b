package io.github.sigwasm.core.analysis;

/**
 * An event handler found by analysis.
 */
public final class AnalyzedHandler {
    public final int id;
    /**
     * The property the handler was found in, e.g. {@code on_click}.
     */
    public final String property;
    public final int elementKey;
    /**
     * The handler closure itself.
     */
    public final Object closure;

    public AnalyzedHandler(int id, String property, int elementKey, Object closure) {
        this.id = id;
        this.property = property;
        this.elementKey = elementKey;
        this.closure = closure;
    }

    /**
     * Get the DOM event name of this handler, e.g. {@code click}.
     *
     * @return The event name.
     */
    public String event() {
        return property.startsWith("on_") ? property.substring(3) : property;
    }

    @Override
    public String toString() {
        return "handler_" + id + "(" + property + " @" + elementKey + ")";
    }
}
