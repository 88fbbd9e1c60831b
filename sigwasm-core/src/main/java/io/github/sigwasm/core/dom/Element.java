package io.github.sigwasm.core.dom;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An HTML element, with its properties and children.
 * <p>
 * Property names starting with {@code on_} hold event handlers, {@code dark_mode} holds a theme signal,
 * and any other property is an attribute.
 */
public final class Element implements Node {
    private final String tag;
    private final Map<String, Object> props;
    private final List<Object> children;

    public Element(@NotNull String tag, @NotNull Map<String, Object> props, @NotNull List<Object> children) {
        this.tag = tag;
        this.props = Collections.unmodifiableMap(props);
        this.children = Collections.unmodifiableList(children);
    }

    public String getTag() {
        return tag;
    }

    /**
     * Get the properties of this element, in declaration order.
     *
     * @return The properties.
     */
    public Map<String, Object> getProps() {
        return props;
    }

    @Nullable
    public Object getProp(String name) {
        return props.get(name);
    }

    public List<Object> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "<" + tag + " " + props.keySet() + ">";
    }
}
