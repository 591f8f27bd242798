package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.core.analysis.Diagnostic;
import io.github.eutro.funcextract.core.ir.Function;
import io.github.eutro.funcextract.core.ir.Region;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link RegionSource} with one candidate per listed function: the listed blocks that
 * exist in the function.
 * <p>
 * Listed blocks that don't exist are reported as {@link Diagnostic.Kind#MALFORMED_INPUT malformed},
 * and since they are left out the candidate will not match the list.
 */
public class BlockListRegionSource implements RegionSource {
    private final BlockList blockList;

    public BlockListRegionSource(BlockList blockList) {
        this.blockList = blockList;
    }

    @Override
    public List<Region> regionsOf(Function func, Consumer<Diagnostic> diagnostics) {
        if (!blockList.hasFunction(func.getName())) return Collections.emptyList();
        List<String> present = new ArrayList<>();
        for (String name : blockList.getBlocks(func.getName())) {
            if (func.getBlock(name) == null) {
                diagnostics.accept(new Diagnostic(Diagnostic.Kind.MALFORMED_INPUT,
                        "No block " + name + " in function " + func.getName()));
            } else {
                present.add(name);
            }
        }
        return Collections.singletonList(Region.of(func, present));
    }
}
