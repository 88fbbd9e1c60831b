package io.github.sigwasm.core.dom;

/**
 * A named property, given among the arguments of {@link Html#el(String, Object...)}.
 */
public final class Prop {
    public final String name;
    public final Object value;

    public Prop(String name, Object value) {
        this.name = name;
        this.value = value;
    }
}
