package io.github.sigwasm.core.dom;

import java.util.Collections;
import java.util.List;

/**
 * A group of children with no element of its own. Fragments take no key.
 */
public final class Fragment implements Node {
    private final List<Object> children;

    public Fragment(List<Object> children) {
        this.children = Collections.unmodifiableList(children);
    }

    public List<Object> getChildren() {
        return children;
    }
}
