package io.github.eutro.funcextract.core.ir;

import io.github.eutro.funcextract.core.debug.DILocalVariable;
import io.github.eutro.funcextract.core.debug.DebugExts;
import io.github.eutro.funcextract.core.ops.InsnKind;
import io.github.eutro.funcextract.core.ops.Op;
import io.github.eutro.funcextract.core.ops.Ops;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions are being inserted, and the source line they are attributed to.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;
    private @Nullable Integer line = null;

    /**
     * Construct an instruction builder, inserting into
     * a specific basic block.
     *
     * @param func The function.
     * @param bb   One of the functions basic blocks.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        setBlock(bb);
    }

    /**
     * Get the block this builder is inserting at the end of.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Set the block this builder should insert at the end of.
     *
     * @param bb The block.
     */
    public void setBlock(BasicBlock bb) {
        if (bb.getFunction() != func) {
            throw new IllegalArgumentException("Block " + bb.getName() + " is not in " + func.getName());
        }
        this.bb = bb;
    }

    /**
     * Attribute instructions inserted from now on to the given source line.
     *
     * @param line The line.
     * @return This builder.
     */
    public IRBuilder at(int line) {
        this.line = line;
        return this;
    }

    /**
     * Insert instructions with no debug location from now on.
     *
     * @return This builder.
     */
    public IRBuilder noLine() {
        this.line = null;
        return this;
    }

    private <I extends Insn> I append(I insn) {
        if (line != null) {
            insn.attachExt(DebugExts.LINE, line);
        }
        bb.append(insn);
        return insn;
    }

    /**
     * Insert an instruction at the end of the block.
     *
     * @param op       The operation.
     * @param name     The name of the result, empty if it has none.
     * @param operands The operands.
     * @return The instruction.
     */
    public Insn insert(Op op, String name, Value... operands) {
        if (op.kind == InsnKind.TERMINATOR) {
            throw new IllegalArgumentException("Use insertTerminator for " + op);
        }
        return append(new Insn(func.getModule(), name, op, Arrays.asList(operands), Collections.emptyList()));
    }

    public StackSlot alloca(String name) {
        return append(new StackSlot(func.getModule(), name));
    }

    public Insn load(Value address, String name) {
        return insert(Ops.LOAD, name, address);
    }

    public Insn store(Value value, Value address) {
        return insert(Ops.STORE, "", value, address);
    }

    public Insn memcpy(Value dest, Value src, Value length) {
        return insert(Ops.MEMCPY, "", dest, src, length);
    }

    /**
     * Declare the source variable that a stack slot holds.
     *
     * @param slot     The slot.
     * @param variable The variable.
     * @return The declaration.
     */
    public Insn declare(StackSlot slot, DILocalVariable variable) {
        Insn insn = insert(Ops.DBG_DECLARE, "", slot);
        insn.attachExt(DebugExts.DECLARED_VARIABLE, variable);
        return insn;
    }

    /**
     * Insert a terminator at the end of the current block.
     *
     * @param op       The operation, which must be a terminator.
     * @param operands The operands.
     * @param targets  The jump targets.
     * @return The terminator.
     */
    public Insn insertTerminator(Op op, List<Value> operands, List<BasicBlock> targets) {
        if (op.kind != InsnKind.TERMINATOR) {
            throw new IllegalArgumentException(op + " is not a terminator");
        }
        return append(new Insn(func.getModule(), "", op, operands, targets));
    }

    public Insn br(BasicBlock target) {
        return insertTerminator(Ops.BR, Collections.emptyList(), Collections.singletonList(target));
    }

    public Insn condBr(Value cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        return insertTerminator(Ops.BR, Collections.singletonList(cond), Arrays.asList(ifTrue, ifFalse));
    }

    public Insn ret(Value... values) {
        return insertTerminator(Ops.RET, Arrays.asList(values), Collections.emptyList());
    }
}
