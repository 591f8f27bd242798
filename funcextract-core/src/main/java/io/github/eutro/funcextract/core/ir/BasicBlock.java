package io.github.eutro.funcextract.core.ir;

import io.github.eutro.funcextract.core.ext.ExtHolder;
import io.github.eutro.funcextract.core.ops.InsnKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block: a straight-line sequence of instructions, optionally ended by a terminator.
 * <p>
 * Successor and predecessor edges are computed when the owning function is {@link Function#seal() sealed}.
 */
public final class BasicBlock extends ExtHolder {
    private final Function function;
    private final String name;
    private final int index;
    private final List<Insn> insns = new ArrayList<>();
    private final List<BasicBlock> succs = new ArrayList<>();
    private final List<BasicBlock> preds = new ArrayList<>();

    BasicBlock(Function function, String name, int index) {
        this.function = function;
        this.name = name;
        this.index = index;
    }

    public Function getFunction() {
        return function;
    }

    public String getName() {
        return name;
    }

    /**
     * Get the position of this block in its function, which never changes.
     *
     * @return The index.
     */
    public int getIndex() {
        return index;
    }

    public List<Insn> getInsns() {
        return Collections.unmodifiableList(insns);
    }

    /**
     * Get the terminator of this block, if it has one.
     *
     * @return The terminator, or null.
     */
    public @Nullable Insn getTerminator() {
        if (insns.isEmpty()) return null;
        Insn last = insns.get(insns.size() - 1);
        return last.getKind() == InsnKind.TERMINATOR ? last : null;
    }

    public List<BasicBlock> getSuccessors() {
        return Collections.unmodifiableList(succs);
    }

    public List<BasicBlock> getPredecessors() {
        return Collections.unmodifiableList(preds);
    }

    void append(Insn insn) {
        function.checkNotSealed();
        if (getTerminator() != null) {
            throw new IllegalStateException("Block " + name + " is already terminated");
        }
        insn.setBlock(this);
        insns.add(insn);
    }

    void linkEdges() {
        Insn term = getTerminator();
        if (term == null) return;
        for (BasicBlock target : term.getTargets()) {
            if (target.function != function) {
                throw new IllegalStateException("Block " + name + " jumps out of its function to " + target.name);
            }
            if (!succs.contains(target)) {
                succs.add(target);
                target.preds.add(this);
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(":\n");
        for (Insn insn : insns) {
            sb.append("  ").append(insn.format()).append('\n');
        }
        return sb.toString();
    }
}
