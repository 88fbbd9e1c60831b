package io.github.sigwasm.core.dom;

import org.jetbrains.annotations.Nullable;

/**
 * Walks an output tree in document order, assigning element keys.
 * <p>
 * Every {@link Element} and every {@link Show} wrapper takes the next key, starting from 1,
 * in depth-first pre-order. {@link Fragment}s take no key, {@link ComponentInstance}s are expanded in place,
 * and {@link Iterable}s and arrays are flattened. Both analysis and rendering go through this walk,
 * so the keys they see always agree.
 */
public class TreeWalker {
    private int key = 0;

    /**
     * A visitor of the walk.
     */
    public interface Visitor {
        default void visitElement(Element element, int key) {
        }

        default void visitElementEnd(Element element, int key) {
        }

        default void visitShow(Show show, int key) {
        }

        default void visitShowEnd(Show show, int key) {
        }

        /**
         * Visit a leaf: any child that is not a node, such as a string, number or signal getter.
         *
         * @param value     The leaf.
         * @param parentKey The key of the nearest enclosing element or show wrapper, or 0 at the top level.
         */
        default void visitLeaf(Object value, int parentKey) {
        }
    }

    /**
     * Walk a tree with a fresh key counter.
     *
     * @param root    The tree.
     * @param visitor The visitor.
     */
    public static void walk(@Nullable Object root, Visitor visitor) {
        new TreeWalker().walk(root, visitor, 0);
    }

    private void walk(@Nullable Object node, Visitor visitor, int parentKey) {
        if (node == null) return;
        if (node instanceof Element) {
            Element element = (Element) node;
            int myKey = ++key;
            visitor.visitElement(element, myKey);
            for (Object child : element.getChildren()) {
                walk(child, visitor, myKey);
            }
            visitor.visitElementEnd(element, myKey);
        } else if (node instanceof Show) {
            Show show = (Show) node;
            int myKey = ++key;
            visitor.visitShow(show, myKey);
            walk(show.getContent(), visitor, myKey);
            visitor.visitShowEnd(show, myKey);
        } else if (node instanceof Fragment) {
            for (Object child : ((Fragment) node).getChildren()) {
                walk(child, visitor, parentKey);
            }
        } else if (node instanceof ComponentInstance) {
            walk(((ComponentInstance) node).render(), visitor, parentKey);
        } else if (node instanceof Iterable) {
            for (Object child : (Iterable<?>) node) {
                walk(child, visitor, parentKey);
            }
        } else if (node instanceof Object[]) {
            for (Object child : (Object[]) node) {
                walk(child, visitor, parentKey);
            }
        } else {
            visitor.visitLeaf(node, parentKey);
        }
    }
}
