package io.github.sigwasm.core.code;

import io.github.sigwasm.core.StackImbalanceException;
import io.github.sigwasm.core.passes.IRPass;
import io.github.sigwasm.core.wasm.ValType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Checks that every block of a function body leaves exactly its declared result on the stack,
 * and that every branch targets a block that encloses it.
 * <p>
 * A failure here is a bug in code generation, never a problem with the input.
 */
public class StackVerifier implements IRPass<FunctionBody, FunctionBody> {
    private final String subject;

    /**
     * Construct a verifier.
     *
     * @param subject What errors should be attributed to, e.g. {@code handler_2}.
     */
    public StackVerifier(String subject) {
        this.subject = subject;
    }

    @Override
    public boolean isInPlace() {
        return true;
    }

    @Override
    public FunctionBody run(FunctionBody fn) {
        new Frame(fn, new ArrayDeque<>()).check(fn.body, fn.type.results, "function body");
        return fn;
    }

    private class Frame {
        final FunctionBody fn;
        final Deque<BlockNode> labels;
        final List<ValType> stack = new ArrayList<>();
        boolean unreachable;

        Frame(FunctionBody fn, Deque<BlockNode> labels) {
            this.fn = fn;
            this.labels = labels;
        }

        void check(List<CodeNode> nodes, List<ValType> expected, String what) {
            for (CodeNode node : nodes) {
                step(node);
            }
            if (unreachable) {
                // anything left below an unconditional branch is discarded
                if (stack.size() > expected.size()) {
                    fail(what + " leaves " + stack + " but declares " + expected);
                }
                return;
            }
            if (!stack.equals(expected)) {
                fail(what + " leaves " + stack + " but declares " + expected);
            }
        }

        void step(CodeNode node) {
            if (node instanceof InsnNode) {
                InsnNode insn = (InsnNode) node;
                for (int i = insn.pops.length - 1; i >= 0; i--) {
                    pop(insn.pops[i], insn.toString());
                }
                Collections.addAll(stack, insn.pushes);
            } else if (node instanceof BlockNode) {
                BlockNode block = (BlockNode) node;
                List<ValType> result = resultOf(block);
                if (block.kind == BlockNode.Kind.IF) {
                    pop(ValType.I32, "if condition");
                    if (block.elseBody == null && !result.isEmpty()) {
                        fail("if with a result has no else branch");
                    }
                }
                labels.push(block);
                new Frame(fn, labels).check(block.body, result, block.toString());
                if (block.elseBody != null) {
                    new Frame(fn, labels).check(block.elseBody, result, "else of " + block);
                }
                labels.pop();
                stack.addAll(result);
            } else if (node instanceof BranchNode) {
                BranchNode branch = (BranchNode) node;
                if (!labels.contains(branch.target)) {
                    fail(branch + " targets a block that does not enclose it");
                }
                if (branch.conditional) pop(ValType.I32, "br_if condition");
                List<ValType> carried = resultOf(branch.target);
                for (int i = carried.size() - 1; i >= 0; i--) {
                    pop(carried.get(i), branch.toString());
                }
                if (branch.conditional) {
                    stack.addAll(carried);
                } else {
                    setUnreachable();
                }
            } else if (node instanceof ReturnNode) {
                List<ValType> results = fn.type.results;
                for (int i = results.size() - 1; i >= 0; i--) {
                    pop(results.get(i), "return");
                }
                setUnreachable();
            } else {
                fail("unexpected node " + node);
            }
        }

        void setUnreachable() {
            unreachable = true;
            stack.clear();
        }

        void pop(ValType expected, String by) {
            if (stack.isEmpty()) {
                if (unreachable) return;
                fail(by + " pops " + expected + " from an empty stack");
            }
            ValType actual = stack.remove(stack.size() - 1);
            if (actual != expected) {
                fail(by + " pops " + expected + " but found " + actual);
            }
        }

        void fail(String message) {
            throw new StackImbalanceException(subject, message);
        }
    }

    private static List<ValType> resultOf(BlockNode block) {
        return block.result == null
                ? Collections.emptyList()
                : Collections.singletonList(block.result);
    }
}
