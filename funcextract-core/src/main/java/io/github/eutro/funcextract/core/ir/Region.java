package io.github.eutro.funcextract.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A set of blocks of a sealed function, with a single entry block, that is to be outlined.
 * <p>
 * Whether the blocks actually form a single-entry single-exit region is not checked.
 * A region may be empty, in which case it has no entry.
 */
public final class Region {
    private final Function function;
    private final @Nullable BasicBlock entry;
    private final List<BasicBlock> blocks;
    private final BlockSet blockSet;

    /**
     * Construct a region.
     *
     * @param function The function the blocks are in.
     * @param entry    The entry block, which must be one of the blocks, or null if there are no blocks.
     * @param blocks   The blocks.
     */
    public Region(Function function, @Nullable BasicBlock entry, Collection<BasicBlock> blocks) {
        if (!function.isSealed()) {
            throw new IllegalStateException("Function " + function.getName() + " must be sealed");
        }
        this.function = function;
        this.blockSet = BlockSet.of(function, blocks);
        List<BasicBlock> ordered = new ArrayList<>();
        for (BasicBlock block : blockSet) {
            ordered.add(block);
        }
        this.blocks = Collections.unmodifiableList(ordered);
        if (entry == null ? !blocks.isEmpty() : !blockSet.contains(entry)) {
            throw new IllegalArgumentException("Entry block must be one of the region's blocks");
        }
        this.entry = entry;
    }

    /**
     * Construct a region from the names of its blocks, picking its entry.
     * <p>
     * The entry is the function entry if that is included, otherwise the first block (in function order)
     * that is jumped to from outside the region, otherwise the first block.
     *
     * @param function The function.
     * @param names    The names of the blocks.
     * @return The region.
     * @throws IllegalArgumentException If a name does not refer to a block of the function.
     */
    public static Region of(Function function, Collection<String> names) {
        List<BasicBlock> blocks = new ArrayList<>();
        for (String name : names) {
            BasicBlock block = function.getBlock(name);
            if (block == null) {
                throw new IllegalArgumentException("No block " + name + " in " + function.getName());
            }
            blocks.add(block);
        }
        BlockSet set = BlockSet.of(function, blocks);
        return new Region(function, findEntry(function, set), blocks);
    }

    private static @Nullable BasicBlock findEntry(Function function, BlockSet set) {
        if (set.contains(function.getEntry())) return function.getEntry();
        for (BasicBlock block : set) {
            for (BasicBlock pred : block.getPredecessors()) {
                if (!set.contains(pred)) return block;
            }
        }
        Iterator<BasicBlock> it = set.iterator();
        return it.hasNext() ? it.next() : null;
    }

    public Function getFunction() {
        return function;
    }

    public @Nullable BasicBlock getEntry() {
        return entry;
    }

    /**
     * Get the blocks of this region, in function order.
     *
     * @return The blocks.
     */
    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BlockSet getBlockSet() {
        return blockSet;
    }

    public boolean contains(BasicBlock block) {
        return blockSet.contains(block);
    }

    public Set<String> getBlockNames() {
        return blockSet.getNames();
    }

    @Override
    public String toString() {
        return function.getName() + blockSet;
    }
}
