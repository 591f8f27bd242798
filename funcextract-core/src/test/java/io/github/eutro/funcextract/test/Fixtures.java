package io.github.eutro.funcextract.test;

import io.github.eutro.funcextract.core.debug.*;
import io.github.eutro.funcextract.core.ir.*;
import io.github.eutro.funcextract.core.ir.Module;
import io.github.eutro.funcextract.core.ops.Ops;

import java.util.Arrays;

/**
 * Small functions shaped like what a C compiler emits at -O0, with debug info.
 */
public class Fixtures {
    public static final DIBasicType INT = new DIBasicType("int");
    public static final DICompositeType NODE = DICompositeType.struct("Node");

    /**
     * <pre>
     *  3 int sumList(struct Node **list, int n) {
     *  4   int total = 0;
     *  5   struct Node *cur = *list;
     *  6   int i = 0;
     *  .
     * 10   while (i < n) {
     * 12     // tmp has no declaration
     * 15     int sq = cur-&gt;val * cur-&gt;val;
     * 16     total += sq;
     * 17     tmp = sq;
     * 18     cur = cur-&gt;next;
     * 19     i++;
     * 20   }
     * 22   return total + sq;
     * 23 }
     * </pre>
     * The loop ({@code while.cond} and {@code while.body}) spans lines 10 to 20.
     */
    public static class SumList {
        public final Module module = new Module("sumlist.c");
        public final Function func = module.newFunction("sumList");
        public final Argument list = func.newArg("list");
        public final Argument n = func.newArg("n");
        public final BasicBlock entry = func.newBlock("entry");
        public final BasicBlock cond = func.newBlock("while.cond");
        public final BasicBlock body = func.newBlock("while.body");
        public final BasicBlock end = func.newBlock("while.end");
        public final StackSlot total;
        public final StackSlot cur;
        public final StackSlot i;
        public final StackSlot sq;
        public final StackSlot tmp;
        public final Insn sqStore;
        public final Insn sqLoad;

        public SumList() {
            func.attachExt(DebugExts.SUBPROGRAM, new DISubprogram("sumList", 3, INT));
            IRBuilder ib = new IRBuilder(func, entry);

            ib.at(3);
            total = ib.alloca("total");
            cur = ib.alloca("cur");
            i = ib.alloca("i");
            sq = ib.alloca("sq");
            tmp = ib.alloca("tmp");
            ib.declare(total, new DILocalVariable("total", 4, INT));
            ib.declare(cur, new DILocalVariable("cur", 5, DIDerivedType.pointerTo(NODE)));
            ib.declare(i, new DILocalVariable("i", 6, INT));
            ib.declare(sq, new DILocalVariable("sq", 15, INT));
            ib.at(4).store(module.constant("0"), total);
            Insn head = ib.at(5).load(list, "head");
            ib.store(head, cur);
            ib.at(6).store(module.constant("0"), i);
            ib.br(cond);

            ib.setBlock(cond);
            Insn iv = ib.at(10).load(i, "iv");
            Insn cmp = ib.insert(Ops.ICMP, "cmp", iv, n);
            ib.condBr(cmp, body, end);

            ib.setBlock(body);
            Insn node = ib.at(15).load(cur, "node");
            Insn valAddr = ib.insert(Ops.GEP, "val.addr", node, module.constant("0"));
            Insn val = ib.load(valAddr, "val");
            Insn square = ib.insert(Ops.MUL, "square", val, val);
            sqStore = ib.store(square, sq);
            Insn t = ib.at(16).load(total, "t");
            ib.store(ib.insert(Ops.ADD, "t.next", t, square), total);
            ib.at(17).store(square, tmp);
            Insn nextAddr = ib.at(18).insert(Ops.GEP, "next.addr", node, module.constant("1"));
            ib.store(ib.load(nextAddr, "next"), cur);
            Insn iv2 = ib.at(19).load(i, "iv2");
            ib.store(ib.insert(Ops.ADD, "inc", iv2, module.constant("1")), i);
            ib.at(20).br(cond);

            ib.setBlock(end);
            Insn tf = ib.at(22).load(total, "total.final");
            sqLoad = ib.load(sq, "sq.final");
            ib.ret(ib.insert(Ops.ADD, "result", tf, sqLoad));

            func.seal();
        }

        public Region loop() {
            return Region.of(func, Arrays.asList("while.cond", "while.body"));
        }
    }
}
