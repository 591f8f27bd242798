package io.github.eutro.funcextract.test;

import io.github.eutro.funcextract.core.ir.*;
import io.github.eutro.funcextract.core.ir.Module;
import io.github.eutro.funcextract.core.ops.Ops;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class IRTest {
    @Test
    void testSealLinksEdges() {
        Fixtures.SumList sl = new Fixtures.SumList();
        assertEquals(Arrays.asList(sl.body, sl.end), sl.cond.getSuccessors());
        assertEquals(Arrays.asList(sl.entry, sl.body), sl.cond.getPredecessors());
        assertTrue(sl.end.getSuccessors().isEmpty());
        assertSame(sl.entry, sl.func.getEntry());
    }

    @Test
    void testDeclarationsAreNotUsers() {
        Fixtures.SumList sl = new Fixtures.SumList();
        for (Insn user : sl.sq.getUsers()) {
            assertNotSame(Ops.DBG_DECLARE, user.getOp());
        }
        assertEquals(Arrays.asList(sl.sqStore, sl.sqLoad), sl.sq.getUsers());
    }

    @Test
    void testSealedFunctionsAreFrozen() {
        Fixtures.SumList sl = new Fixtures.SumList();
        assertThrows(IllegalStateException.class, sl.func::seal);
        assertThrows(IllegalStateException.class, () -> sl.func.newBlock("late"));
        assertThrows(IllegalStateException.class, () -> new IRBuilder(sl.func, sl.body).alloca("late"));
    }

    @Test
    void testMalformedConstruction() {
        Module module = new Module("bad.c");
        Function func = module.newFunction("f");
        BasicBlock entry = func.newBlock("entry");
        assertThrows(IllegalArgumentException.class, () -> func.newBlock("entry"));
        assertThrows(IllegalArgumentException.class, () -> module.newFunction("f"));

        IRBuilder ib = new IRBuilder(func, entry);
        ib.ret();
        assertThrows(IllegalStateException.class, () -> ib.ret());
        assertThrows(IllegalArgumentException.class, () -> ib.insert(Ops.BR, ""));

        Function other = module.newFunction("g");
        assertThrows(IllegalArgumentException.class, () -> ib.setBlock(other.newBlock("entry")));
    }

    @Test
    void testRegions() {
        Fixtures.SumList sl = new Fixtures.SumList();
        Region loop = sl.loop();
        assertSame(sl.cond, loop.getEntry());
        assertEquals(Arrays.asList(sl.cond, sl.body), loop.getBlocks());

        Region all = Region.of(sl.func, Arrays.asList("while.end", "entry", "while.body", "while.cond"));
        assertSame(sl.entry, all.getEntry());

        assertThrows(IllegalArgumentException.class,
                () -> Region.of(sl.func, Collections.singletonList("if.then")));
        assertThrows(IllegalArgumentException.class,
                () -> new Region(sl.func, sl.entry, Collections.singletonList(sl.body)));

        Module module = new Module("open.c");
        Function open = module.newFunction("open");
        open.newBlock("entry");
        assertThrows(IllegalStateException.class,
                () -> Region.of(open, Collections.singletonList("entry")));
    }

    @Test
    void testValueIds() {
        Fixtures.SumList sl = new Fixtures.SumList();
        Set<Integer> ids = new HashSet<>();
        for (BasicBlock block : sl.func.getBlocks()) {
            for (Insn insn : block.getInsns()) {
                assertTrue(ids.add(insn.getId()));
                assertSame(insn, sl.module.getValue(insn.getId()));
                assertEquals(insn.getId(), insn.hashCode());
            }
        }
    }
}
