package io.github.eutro.funcextract.test;

import io.github.eutro.funcextract.core.analysis.OperandDependencyResolver;
import io.github.eutro.funcextract.core.ir.*;
import io.github.eutro.funcextract.core.ir.Module;
import io.github.eutro.funcextract.core.ops.Ops;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class OperandDependencyResolverTest {
    static final OperandDependencyResolver RESOLVER = OperandDependencyResolver.INSTANCE;

    @Test
    void testWriteDependsOnValueAndAddress() {
        Fixtures.SumList sl = new Fixtures.SumList();
        // sq = cur->val * cur->val
        assertEquals(new LinkedHashSet<>(Arrays.asList(sl.cur, sl.sq)), RESOLVER.run(sl.sqStore));
        assertEquals(Collections.singleton(sl.sq), RESOLVER.resolveWritten(sl.sqStore));
        assertEquals(Collections.singleton(sl.cur), RESOLVER.resolveOperand(sl.sqStore, 0));
    }

    @Test
    void testIdempotent() {
        Fixtures.SumList sl = new Fixtures.SumList();
        for (BasicBlock block : sl.func.getBlocks()) {
            for (Insn insn : block.getInsns()) {
                assertEquals(RESOLVER.run(insn), RESOLVER.run(insn));
            }
        }
    }

    @Test
    void testArgumentsAndConstantsDiscarded() {
        Fixtures.SumList sl = new Fixtures.SumList();
        Insn head = sl.entry.getInsns().stream()
                .filter(it -> "head".equals(it.getName()))
                .findFirst()
                .orElseThrow(AssertionError::new);
        assertTrue(RESOLVER.run(head).isEmpty());
        assertTrue(RESOLVER.resolveWritten(head).isEmpty());
    }

    @Test
    void testThroughGlobalsAndCopies() {
        Module module = new Module("copy.c");
        GlobalVariable config = module.newGlobal("config");
        Function func = module.newFunction("snapshot");
        BasicBlock entry = func.newBlock("entry");
        IRBuilder ib = new IRBuilder(func, entry);
        StackSlot local = ib.alloca("local");
        Insn dest = ib.insert(Ops.BITCAST, "dest", local);
        Insn src = ib.insert(Ops.BITCAST, "src", config);
        Insn copy = ib.memcpy(dest, src, module.constant("16"));
        ib.ret();
        func.seal();

        assertEquals(new LinkedHashSet<>(Arrays.asList(config, local)), RESOLVER.run(copy));
        assertEquals(Collections.singleton(local), RESOLVER.resolveWritten(copy));
    }

    @Test
    void testSharedSubexpressions() {
        Module module = new Module("diamond.c");
        Function func = module.newFunction("diamond");
        BasicBlock entry = func.newBlock("entry");
        IRBuilder ib = new IRBuilder(func, entry);
        StackSlot a = ib.alloca("a");
        StackSlot b = ib.alloca("b");
        Value x = ib.load(a, "x");
        Value y = ib.insert(Ops.ADD, "y", x, x);
        Value z = ib.insert(Ops.MUL, "z", y, x);
        Insn store = ib.store(ib.insert(Ops.ADD, "w", z, y), b);
        ib.ret();
        func.seal();

        assertEquals(Arrays.asList(a, b), new ArrayList<>(RESOLVER.run(store)));
    }
}
