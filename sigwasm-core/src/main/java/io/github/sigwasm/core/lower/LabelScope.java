package io.github.sigwasm.core.lower;

import io.github.sigwasm.core.code.BlockNode;
import org.jetbrains.annotations.Nullable;

/**
 * The jump targets reachable by a {@code br} from the code being lowered.
 * <p>
 * A label maps an operation index to an enclosing block whose end falls just before that operation.
 * Scopes are immutable, and nested regions hide the labels of outer blocks that end before them.
 */
final class LabelScope {
    static final LabelScope EMPTY = new LabelScope(null, null, 0);

    @Nullable
    private final LabelScope parent;
    @Nullable
    private final Label label;
    /**
     * For a filter, the lowest position still visible through it.
     */
    private final int min;

    private LabelScope(@Nullable LabelScope parent, @Nullable Label label, int min) {
        this.parent = parent;
        this.label = label;
        this.min = min;
    }

    static final class Label {
        final int position;
        final BlockNode block;
        /**
         * The stack height just outside the block.
         */
        final int base;
        boolean used;
        boolean placed;

        Label(int position, BlockNode block, int base) {
            this.position = position;
            this.block = block;
            this.base = base;
        }
    }

    LabelScope push(Label label) {
        return new LabelScope(this, label, 0);
    }

    LabelScope push(int position, BlockNode block, int base) {
        return push(new Label(position, block, base));
    }

    /**
     * Hide the labels of positions below a bound.
     *
     * @param min The lowest visible position.
     * @return The filtered scope.
     */
    LabelScope filter(int min) {
        return new LabelScope(this, null, min);
    }

    /**
     * Find the innermost visible label of a position.
     *
     * @param position The operation index.
     * @return The label, or null if it is not visible.
     */
    @Nullable
    Label find(int position) {
        int bound = Integer.MIN_VALUE;
        for (LabelScope scope = this; scope != null && scope.parent != null; scope = scope.parent) {
            if (scope.label == null) {
                bound = Math.max(bound, scope.min);
            } else if (scope.label.position == position && position >= bound) {
                return scope.label;
            }
        }
        return null;
    }
}
