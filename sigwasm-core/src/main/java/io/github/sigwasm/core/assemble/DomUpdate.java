package io.github.sigwasm.core.assemble;

/**
 * A host callback that refreshes the page after a signal changes.
 */
public final class DomUpdate {
    public enum Kind {
        /**
         * Replace the text of an element.
         */
        TEXT,
        /**
         * Set an attribute of an element.
         */
        ATTR,
        /**
         * Show or hide an element.
         */
        VISIBLE,
        /**
         * Switch the page theme.
         */
        THEME,
    }

    public final Kind kind;
    public final long signalId;
    /**
     * The element to update, or 0 for {@link Kind#THEME}.
     */
    public final int elementKey;
    /**
     * The index of the attribute in the attribute table for {@link Kind#ATTR}, otherwise -1.
     */
    public final int attribute;

    public DomUpdate(Kind kind, long signalId, int elementKey, int attribute) {
        this.kind = kind;
        this.signalId = signalId;
        this.elementKey = elementKey;
        this.attribute = attribute;
    }

    @Override
    public String toString() {
        return kind + "(signal_" + signalId + " -> " + elementKey + (attribute >= 0 ? ", attr " + attribute : "") + ")";
    }
}
