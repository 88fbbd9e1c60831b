package io.github.sigwasm.core.dom;

/**
 * A structural node of a component's output tree.
 * <p>
 * Trees also contain plain leaves (strings, numbers, signal getters), which are not nodes.
 *
 * @see TreeWalker
 */
public interface Node {
}
