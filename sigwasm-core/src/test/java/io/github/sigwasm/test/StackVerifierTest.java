package io.github.sigwasm.test;

import io.github.sigwasm.core.StackImbalanceException;
import io.github.sigwasm.core.code.*;
import io.github.sigwasm.core.wasm.FuncType;
import io.github.sigwasm.core.wasm.Opcodes;
import io.github.sigwasm.core.wasm.ValType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class StackVerifierTest {
    private static final ValType[] NO_PARAMS = {};

    static void verify(FunctionBody fn) {
        new StackVerifier("test").run(fn);
    }

    @Test
    void testBalanced() {
        FunctionBody fn = new FunctionBody(FuncType.of(NO_PARAMS, ValType.I32));
        fn.body.add(Insns.i32Const(2));
        fn.body.add(Insns.i32Const(3));
        fn.body.add(Insns.op(Opcodes.I32_ADD));
        verify(fn);
    }

    @Test
    void testLeftover() {
        FunctionBody fn = new FunctionBody(FuncType.VOID);
        fn.body.add(Insns.i32Const(1));
        StackImbalanceException e = assertThrows(StackImbalanceException.class, () -> verify(fn));
        assertEquals("test", e.getSubject());
    }

    @Test
    void testEmptyPop() {
        FunctionBody fn = new FunctionBody(FuncType.VOID);
        fn.body.add(Insns.i32Const(1));
        fn.body.add(Insns.op(Opcodes.I32_EQ));
        assertThrows(StackImbalanceException.class, () -> verify(fn));
    }

    @Test
    void testTypeMismatch() {
        FunctionBody fn = new FunctionBody(FuncType.of(NO_PARAMS, ValType.I64));
        fn.body.add(Insns.i32Const(1));
        assertThrows(StackImbalanceException.class, () -> verify(fn));
    }

    @Test
    void testBranchCarriesResult() {
        FunctionBody fn = new FunctionBody(FuncType.VOID);
        BlockNode block = BlockNode.block(ValType.I32);
        block.body.add(Insns.i32Const(1));
        block.body.add(new BranchNode(false, block));
        fn.body.add(block);
        fn.body.add(Insns.drop(ValType.I32));
        verify(fn);
    }

    @Test
    void testBranchOutsideBlock() {
        FunctionBody fn = new FunctionBody(FuncType.VOID);
        BlockNode other = BlockNode.block(null);
        BlockNode block = BlockNode.block(null);
        block.body.add(new BranchNode(false, other));
        fn.body.add(block);
        assertThrows(StackImbalanceException.class, () -> verify(fn));
    }

    @Test
    void testTypedIfNeedsElse() {
        FunctionBody fn = new FunctionBody(FuncType.of(NO_PARAMS, ValType.I32));
        fn.body.add(Insns.i32Const(1));
        BlockNode ifBlock = BlockNode.ifBlock(ValType.I32);
        ifBlock.body.add(Insns.i32Const(2));
        fn.body.add(ifBlock);
        assertThrows(StackImbalanceException.class, () -> verify(fn));

        ifBlock.addElse().add(Insns.i32Const(3));
        verify(fn);
    }

    @Test
    void testReturnDiscardsRest() {
        FunctionBody fn = new FunctionBody(FuncType.VOID);
        BlockNode ifBlock = BlockNode.ifBlock(null);
        ifBlock.body.add(new ReturnNode());
        fn.body.add(Insns.i32Const(0));
        fn.body.add(ifBlock);
        verify(fn);
    }

    @Test
    void testLocalsFollowParams() {
        FunctionBody fn = new FunctionBody(FuncType.of(new ValType[]{ValType.I32, ValType.F64}));
        assertEquals(2, fn.addLocal(ValType.I64));
        assertEquals(3, fn.addLocal(ValType.I32));
        assertEquals(Arrays.asList(ValType.I64, ValType.I32), fn.locals);
    }
}
