package io.github.sigwasm.core.code;

import io.github.sigwasm.core.wasm.ValType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A structured {@code block} or {@code if}, optionally with an {@code else}.
 * <p>
 * Branches to a block exit it, continuing after its {@code end}.
 */
public final class BlockNode extends CodeNode {
    /**
     * The kind of block.
     */
    public enum Kind {
        BLOCK,
        IF,
    }

    public final Kind kind;
    /**
     * The single result of the block, or null if it leaves nothing.
     */
    @Nullable
    public final ValType result;
    public final List<CodeNode> body = new ArrayList<>();
    /**
     * The else branch of an {@link Kind#IF}, or null if it has none.
     */
    @Nullable
    public List<CodeNode> elseBody;

    private BlockNode(Kind kind, @Nullable ValType result) {
        this.kind = kind;
        this.result = result;
    }

    public static BlockNode block(@Nullable ValType result) {
        return new BlockNode(Kind.BLOCK, result);
    }

    public static BlockNode ifBlock(@Nullable ValType result) {
        return new BlockNode(Kind.IF, result);
    }

    /**
     * Add an empty else branch to this if, and return it.
     *
     * @return The else branch.
     */
    public List<CodeNode> addElse() {
        if (kind != Kind.IF) throw new IllegalStateException("only if blocks have else branches");
        elseBody = new ArrayList<>();
        return elseBody;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + (result == null ? "" : " (result " + result + ")");
    }
}
