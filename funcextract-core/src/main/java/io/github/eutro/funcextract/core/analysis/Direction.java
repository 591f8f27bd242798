package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.ir.BasicBlock;

import java.util.List;

/**
 * A direction to follow control flow edges in.
 */
public enum Direction {
    FORWARD {
        @Override
        public List<BasicBlock> next(BasicBlock block) {
            return block.getSuccessors();
        }
    },
    BACKWARD {
        @Override
        public List<BasicBlock> next(BasicBlock block) {
            return block.getPredecessors();
        }
    };

    /**
     * Get the blocks one edge away from {@code block} in this direction.
     *
     * @param block The block.
     * @return The neighbouring blocks.
     */
    public abstract List<BasicBlock> next(BasicBlock block);
}
