package io.github.eutro.funcextract.core.ir;

import io.github.eutro.funcextract.core.debug.DebugExts;
import io.github.eutro.funcextract.core.ops.InsnKind;
import io.github.eutro.funcextract.core.ops.Op;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An instruction. Instructions are values too: the value of an instruction is its result.
 */
public class Insn extends Value {
    private final Op op;
    private final List<Value> operands;
    private final List<BasicBlock> targets;
    private BasicBlock block = null;

    Insn(Module module, String name, Op op, List<Value> operands, List<BasicBlock> targets) {
        super(module, name);
        this.op = op;
        this.operands = new ArrayList<>(operands);
        this.targets = new ArrayList<>(targets);
    }

    public Op getOp() {
        return op;
    }

    public InsnKind getKind() {
        return op.kind;
    }

    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public Value getOperand(int index) {
        return operands.get(index);
    }

    /**
     * Get the blocks this instruction may jump to. Only terminators have targets.
     *
     * @return The jump targets.
     */
    public List<BasicBlock> getTargets() {
        return Collections.unmodifiableList(targets);
    }

    /**
     * Get the block this instruction is in.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return block;
    }

    void setBlock(BasicBlock block) {
        if (this.block != null) {
            throw new IllegalStateException(this + " is already in " + this.block.getName());
        }
        this.block = block;
    }

    /**
     * Get the source line this instruction was attributed to, if it has a debug location.
     *
     * @return The line, or null.
     */
    public @Nullable Integer getLine() {
        return getNullable(DebugExts.LINE);
    }

    /**
     * Render this instruction in full, rather than as an operand reference.
     *
     * @return The rendered instruction.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        if (!getName().isEmpty()) {
            sb.append(this).append(" = ");
        }
        sb.append(op);
        for (int i = 0; i < operands.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(operands.get(i));
        }
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.getName());
            }
        }
        Integer line = getLine();
        if (line != null) {
            sb.append(" !line ").append(line);
        }
        return sb.toString();
    }
}
