package io.github.eutro.funcextract.core.passes;

import io.github.eutro.funcextract.core.debug.DISubprogram;
import io.github.eutro.funcextract.core.debug.DebugExts;
import io.github.eutro.funcextract.core.debug.LineBounds;
import io.github.eutro.funcextract.core.ir.Function;

/**
 * Computes the lines spanned by a function: from its declaration, over all its instructions' debug locations.
 * <p>
 * A function without a {@link DebugExts#SUBPROGRAM subprogram} has {@link LineBounds#EMPTY unavailable} bounds,
 * even if its instructions have locations.
 */
public class ComputeFunctionBounds implements IRPass<Function, LineBounds> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeFunctionBounds INSTANCE = new ComputeFunctionBounds();

    @Override
    public LineBounds run(Function func) {
        DISubprogram sp = func.getNullable(DebugExts.SUBPROGRAM);
        if (sp == null) return LineBounds.EMPTY;
        return ComputeRegionBounds.span(func.getBlocks(), LineBounds.of(sp.getLine(), sp.getLine()));
    }
}
