package io.github.sigwasm.core.dom;

import io.github.sigwasm.core.signal.SignalGetter;
import org.jetbrains.annotations.Nullable;

/**
 * Content whose visibility is gated by a condition, typically a signal getter.
 * <p>
 * A show node is rendered as a wrapper {@code span}, which takes a key of its own.
 */
public final class Show implements Node {
    private final Object condition;
    @Nullable
    private final Object content;
    private final boolean initialVisible;

    public Show(Object condition, @Nullable Object content) {
        this.condition = condition;
        this.content = content;
        this.initialVisible = isTruthy(condition instanceof SignalGetter
                ? ((SignalGetter) condition).value()
                : condition);
    }

    /**
     * Test a value for truthiness: false, zero and null are falsy, anything else is truthy.
     *
     * @param value The value.
     * @return Whether it is truthy.
     */
    public static boolean isTruthy(@Nullable Object value) {
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return ((Number) value).doubleValue() != 0;
        if (value instanceof Character) return (Character) value != 0;
        return true;
    }

    public Object getCondition() {
        return condition;
    }

    @Nullable
    public Object getContent() {
        return content;
    }

    /**
     * Get whether the content was visible when this node was created.
     *
     * @return Whether the content is initially visible.
     */
    public boolean isInitialVisible() {
        return initialVisible;
    }
}
