package io.github.eutro.funcextract.test;

import io.github.eutro.funcextract.core.debug.*;
import io.github.eutro.funcextract.core.ir.*;
import io.github.eutro.funcextract.core.ir.Module;
import io.github.eutro.funcextract.core.passes.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    @Test
    void testBounds() {
        Fixtures.SumList sl = new Fixtures.SumList();
        assertEquals(LineBounds.of(10, 20), ComputeRegionBounds.INSTANCE.run(sl.loop()));
        assertEquals(LineBounds.of(3, 22), ComputeFunctionBounds.INSTANCE.run(sl.func));
        assertEquals(LineBounds.of(10, 10),
                ComputeRegionBounds.INSTANCE.run(Region.of(sl.func, Collections.singletonList("while.cond"))));
    }

    @Test
    void testBoundsWithoutDebugInfo() {
        Module module = new Module("nodebug.c");
        Function func = module.newFunction("f");
        BasicBlock entry = func.newBlock("entry");
        BasicBlock exit = func.newBlock("exit");
        IRBuilder ib = new IRBuilder(func, entry);
        ib.br(exit);
        ib.setBlock(exit);
        ib.at(4).ret();
        func.seal();

        assertTrue(ComputeRegionBounds.INSTANCE.run(Region.of(func, Collections.singletonList("entry"))).isEmpty());
        assertEquals(LineBounds.of(4, 4), ComputeRegionBounds.INSTANCE.run(Region.of(func, Collections.singletonList("exit"))));
        // no subprogram, so nothing is known about the function even though it has locations
        assertTrue(ComputeFunctionBounds.INSTANCE.run(func).isEmpty());
    }

    @Test
    void testExits() {
        Fixtures.SumList sl = new Fixtures.SumList();
        assertEquals(new TreeSet<>(Collections.singleton(10)), FindRegionExits.INSTANCE.run(sl.loop()));
        assertEquals(new TreeSet<>(Collections.singleton(22)),
                FindRegionExits.INSTANCE.run(Region.of(sl.func, Collections.singletonList("while.end"))));
        // the body jumps back to the condition, outside the region
        assertEquals(new TreeSet<>(Collections.singleton(20)),
                FindRegionExits.INSTANCE.run(Region.of(sl.func, Collections.singletonList("while.body"))));
        assertTrue(FindRegionExits.INSTANCE.run(Region.of(sl.func,
                Arrays.asList("entry", "while.cond", "while.body", "while.end"))).contains(22));
    }

    @Test
    void testCollectVariables() {
        Fixtures.SumList sl = new Fixtures.SumList();
        GlobalVariable undeclared = sl.module.newGlobal("scratch");
        GlobalVariable counter = sl.module.newGlobal("counter");
        DIGlobalVariable counterVar = new DIGlobalVariable("counter", 1, Fixtures.INT);
        counter.attachExt(DebugExts.GLOBAL_VARIABLE, counterVar);

        VariableDebugInfo info = CollectVariableDebugInfo.INSTANCE.run(sl.func);
        assertEquals(5, info.size());
        assertEquals(Optional.of(counterVar), info.lookup(counter));
        assertFalse(info.lookup(undeclared).isPresent());
        assertFalse(info.lookup(sl.tmp).isPresent());
        DIVariable sq = info.lookup(sl.sq).orElseThrow(AssertionError::new);
        assertEquals("sq", sq.getName());
        assertEquals(15, sq.getLine());
    }

    @Test
    void testComposition() {
        Fixtures.SumList sl = new Fixtures.SumList();
        IRPass<Region, Integer> width = ComputeRegionBounds.INSTANCE
                .then(bounds -> bounds.getEnd() - bounds.getStart());
        assertEquals(Integer.valueOf(10), width.run(sl.loop()));
    }
}
