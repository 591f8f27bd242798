package io.github.eutro.funcextract.core.passes;

import io.github.eutro.funcextract.core.ir.BasicBlock;
import io.github.eutro.funcextract.core.ir.Insn;
import io.github.eutro.funcextract.core.ir.Region;
import io.github.eutro.funcextract.core.ops.Ops;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Finds the source lines of the region's exiting edges: terminators inside the region
 * that return, or that jump to a block outside it.
 * <p>
 * Terminators without a debug location are not reported.
 */
public class FindRegionExits implements IRPass<Region, SortedSet<Integer>> {
    /**
     * A singleton instance of this pass.
     */
    public static final FindRegionExits INSTANCE = new FindRegionExits();

    @Override
    public SortedSet<Integer> run(Region region) {
        SortedSet<Integer> lines = new TreeSet<>();
        for (BasicBlock block : region.getBlocks()) {
            Insn term = block.getTerminator();
            if (term == null || term.getLine() == null) continue;
            boolean exits = term.getOp() == Ops.RET;
            for (BasicBlock target : term.getTargets()) {
                if (!region.contains(target)) {
                    exits = true;
                    break;
                }
            }
            if (exits) lines.add(term.getLine());
        }
        return Collections.unmodifiableSortedSet(lines);
    }
}
