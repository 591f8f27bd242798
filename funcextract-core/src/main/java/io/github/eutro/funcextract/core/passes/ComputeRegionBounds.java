package io.github.eutro.funcextract.core.passes;

import io.github.eutro.funcextract.core.debug.LineBounds;
import io.github.eutro.funcextract.core.ir.BasicBlock;
import io.github.eutro.funcextract.core.ir.Insn;
import io.github.eutro.funcextract.core.ir.Region;

/**
 * Computes the lines spanned by the debug locations of a region's instructions.
 * The bounds are {@link LineBounds#EMPTY empty} if no instruction has a location.
 */
public class ComputeRegionBounds implements IRPass<Region, LineBounds> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeRegionBounds INSTANCE = new ComputeRegionBounds();

    @Override
    public LineBounds run(Region region) {
        return span(region.getBlocks(), LineBounds.EMPTY);
    }

    static LineBounds span(Iterable<BasicBlock> blocks, LineBounds bounds) {
        for (BasicBlock block : blocks) {
            for (Insn insn : block.getInsns()) {
                Integer line = insn.getLine();
                if (line != null) {
                    bounds = bounds.extend(line);
                }
            }
        }
        return bounds;
    }
}
