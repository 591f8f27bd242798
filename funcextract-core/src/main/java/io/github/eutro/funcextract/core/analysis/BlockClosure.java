package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.ir.BasicBlock;
import io.github.eutro.funcextract.core.ir.BlockSet;
import io.github.eutro.funcextract.core.ir.Region;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Computes the blocks reachable from a block, and from that the blocks before and after a region.
 */
public final class BlockClosure {
    private BlockClosure() {
    }

    /**
     * Get every block reachable from {@code entry} following edges in the given direction,
     * including {@code entry} itself.
     *
     * @param entry     The block to start from.
     * @param direction The direction to follow edges in.
     * @return The reachable blocks.
     */
    public static BlockSet closure(BasicBlock entry, Direction direction) {
        BlockSet visited = new BlockSet(entry.getFunction());
        Deque<BasicBlock> queue = new ArrayDeque<>();
        queue.add(entry);
        while (!queue.isEmpty()) {
            BasicBlock current = queue.poll();
            if (!visited.add(current)) continue;
            queue.addAll(direction.next(current));
        }
        return visited;
    }

    /**
     * Get the blocks that can run before the region: those reaching its entry, excluding its own blocks.
     *
     * @param region The region.
     * @return The predecessor set.
     */
    public static BlockSet predecessorsOf(Region region) {
        return outside(region, Direction.BACKWARD);
    }

    /**
     * Get the blocks that can run after the region: those reachable from its entry, excluding its own blocks.
     *
     * @param region The region.
     * @return The successor set.
     */
    public static BlockSet successorsOf(Region region) {
        return outside(region, Direction.FORWARD);
    }

    private static BlockSet outside(Region region, Direction direction) {
        BasicBlock entry = region.getEntry();
        if (entry == null) return new BlockSet(region.getFunction());
        // the graph may loop back through the region, so its blocks are removed after the walk
        return closure(entry, direction).minus(region.getBlockSet());
    }
}
