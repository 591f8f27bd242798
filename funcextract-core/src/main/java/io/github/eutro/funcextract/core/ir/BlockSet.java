package io.github.eutro.funcextract.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A set of blocks of one function, stored as a bit set over their {@link BasicBlock#getIndex() indices}.
 * <p>
 * Iteration is in function order.
 */
public final class BlockSet implements Iterable<BasicBlock> {
    private final Function function;
    private final BitSet bits;

    public BlockSet(Function function) {
        this(function, new BitSet(function.getBlocks().size()));
    }

    private BlockSet(Function function, BitSet bits) {
        this.function = function;
        this.bits = bits;
    }

    public static BlockSet of(Function function, Iterable<BasicBlock> blocks) {
        BlockSet set = new BlockSet(function);
        for (BasicBlock block : blocks) {
            set.add(block);
        }
        return set;
    }

    public Function getFunction() {
        return function;
    }

    public boolean add(BasicBlock block) {
        if (block.getFunction() != function) {
            throw new IllegalArgumentException("Block " + block.getName() + " is not in " + function.getName());
        }
        if (bits.get(block.getIndex())) return false;
        bits.set(block.getIndex());
        return true;
    }

    public boolean contains(BasicBlock block) {
        return block != null
                && block.getFunction() == function
                && bits.get(block.getIndex());
    }

    /**
     * Get the blocks in this set that are not in {@code other}, as a new set.
     *
     * @param other The blocks to exclude.
     * @return The difference.
     */
    public BlockSet minus(BlockSet other) {
        BitSet result = (BitSet) bits.clone();
        if (other.function == function) {
            result.andNot(other.bits);
        }
        return new BlockSet(function, result);
    }

    public int size() {
        return bits.cardinality();
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    public Set<String> getNames() {
        Set<String> names = new LinkedHashSet<>();
        for (BasicBlock block : this) {
            names.add(block.getName());
        }
        return names;
    }

    @NotNull
    @Override
    public Iterator<BasicBlock> iterator() {
        List<BasicBlock> blocks = function.getBlocks();
        return new Iterator<BasicBlock>() {
            int next = bits.nextSetBit(0);

            @Override
            public boolean hasNext() {
                return next >= 0;
            }

            @Override
            public BasicBlock next() {
                if (next < 0) throw new NoSuchElementException();
                BasicBlock block = blocks.get(next);
                next = bits.nextSetBit(next + 1);
                return block;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlockSet that = (BlockSet) o;
        return function == that.function && bits.equals(that.bits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function.getName(), bits);
    }

    @Override
    public String toString() {
        return getNames().toString();
    }
}
