package io.github.sigwasm.core.dom;

import java.util.function.Supplier;

/**
 * A sub-component, expanded in place when the tree is walked.
 * <p>
 * The body is run at most once, so walking a tree twice sees the same output,
 * and creates any signals of the sub-component only once.
 */
public final class ComponentInstance implements Node {
    private final String name;
    private final Supplier<?> body;
    private boolean rendered;
    private Object output;

    public ComponentInstance(String name, Supplier<?> body) {
        this.name = name;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    /**
     * Get the output of the sub-component, rendering it if it has not been already.
     *
     * @return The output.
     */
    public Object render() {
        if (!rendered) {
            output = body.get();
            rendered = true;
        }
        return output;
    }
}
