package io.github.sigwasm.core.dom;

import io.github.sigwasm.core.signal.SignalGetter;
import io.github.sigwasm.core.signal.SignalSetter;

import java.util.*;
import java.util.function.Supplier;

/**
 * Builders for output trees.
 * <p>
 * Element builders take a mix of {@link Prop}s and children, e.g.
 * <pre>{@code
 * div(attr("class", "counter"),
 *     button(onClick(() -> count.set(count.get() + 1)), "+"),
 *     span(count))
 * }</pre>
 */
public final class Html {
    private Html() {
    }

    public static Element el(String tag, Object... args) {
        Map<String, Object> props = new LinkedHashMap<>();
        List<Object> children = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof Prop) {
                Prop prop = (Prop) arg;
                props.put(prop.name, prop.value);
            } else {
                children.add(arg);
            }
        }
        return new Element(tag, props, children);
    }

    public static Element div(Object... args) {
        return el("div", args);
    }

    public static Element span(Object... args) {
        return el("span", args);
    }

    public static Element p(Object... args) {
        return el("p", args);
    }

    public static Element h1(Object... args) {
        return el("h1", args);
    }

    public static Element button(Object... args) {
        return el("button", args);
    }

    public static Element input(Object... args) {
        return el("input", args);
    }

    public static Element ul(Object... args) {
        return el("ul", args);
    }

    public static Element li(Object... args) {
        return el("li", args);
    }

    public static Prop attr(String name, Object value) {
        return new Prop(name, value);
    }

    /**
     * A handler for the given DOM event, e.g. {@code on("click", ...)} for {@code on_click}.
     *
     * @param event   The event name.
     * @param handler The handler.
     * @return The property.
     */
    public static Prop on(String event, Handler handler) {
        return new Prop("on_" + event, handler);
    }

    public static Prop onClick(Handler handler) {
        return on("click", handler);
    }

    /**
     * Bind a setter directly as the input handler of an {@code input} element.
     *
     * @param setter The setter.
     * @return The property.
     */
    public static Prop onInput(SignalSetter setter) {
        return new Prop("on_input", setter);
    }

    public static Prop darkMode(SignalGetter getter) {
        return new Prop("dark_mode", getter);
    }

    public static Fragment fragment(Object... children) {
        return new Fragment(Arrays.asList(children));
    }

    public static Show show(Object condition, Object content) {
        return new Show(condition, content);
    }

    public static ComponentInstance component(String name, Supplier<?> body) {
        return new ComponentInstance(name, body);
    }
}
