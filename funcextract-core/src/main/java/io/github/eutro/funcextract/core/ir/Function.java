package io.github.eutro.funcextract.core.ir;

import io.github.eutro.funcextract.core.ext.ExtHolder;
import io.github.eutro.funcextract.core.ops.InsnKind;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A function: an ordered collection of basic blocks, the first of which is the entry.
 * <p>
 * A function is built up through {@link #newArg(String)}, {@link #newBlock(String)} and
 * an {@link IRBuilder}, then {@link #seal() sealed}. Sealing computes the control flow edges
 * and the users of every value, after which the function can no longer change.
 */
public final class Function extends ExtHolder {
    private final Module module;
    private final String name;
    private final List<Argument> args = new ArrayList<>();
    private final List<BasicBlock> blocks = new ArrayList<>(); // [0] is entry
    private final Map<String, BasicBlock> blocksByName = new HashMap<>();
    private boolean sealed = false;

    Function(Module module, String name) {
        this.module = module;
        this.name = name;
    }

    public Module getModule() {
        return module;
    }

    public String getName() {
        return name;
    }

    public List<Argument> getArgs() {
        return Collections.unmodifiableList(args);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Get the entry block of this function.
     *
     * @return The entry block, or null if the function has no blocks.
     */
    public @Nullable BasicBlock getEntry() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /**
     * Look up a block by its name.
     *
     * @param name The name of the block.
     * @return The block, or null if there is no block with that name.
     */
    public @Nullable BasicBlock getBlock(String name) {
        return blocksByName.get(name);
    }

    public Argument newArg(String name) {
        checkNotSealed();
        Argument arg = new Argument(this, args.size(), name);
        args.add(arg);
        return arg;
    }

    public BasicBlock newBlock(String name) {
        checkNotSealed();
        if (blocksByName.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate block " + name + " in " + this.name);
        }
        BasicBlock bb = new BasicBlock(this, name, blocks.size());
        blocks.add(bb);
        blocksByName.put(name, bb);
        return bb;
    }

    /**
     * Seal this function, linking the control flow graph and recording the users of every operand.
     * <p>
     * {@link InsnKind#DECLARE Declarations} are not recorded as users of the slots they describe.
     */
    public void seal() {
        checkNotSealed();
        for (BasicBlock block : blocks) {
            block.linkEdges();
        }
        for (BasicBlock block : blocks) {
            for (Insn insn : block.getInsns()) {
                if (insn.getKind() == InsnKind.DECLARE) continue;
                for (Value operand : insn.getOperands()) {
                    operand.addUser(insn);
                }
            }
        }
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("Function " + name + " is sealed");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(args.get(i));
        }
        sb.append(") {\n");
        for (BasicBlock block : blocks) {
            sb.append(block);
        }
        sb.append("}");
        return sb.toString();
    }
}
