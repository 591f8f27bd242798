package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.debug.LineBounds;
import io.github.eutro.funcextract.core.debug.VariableDebugInfo;
import io.github.eutro.funcextract.core.ir.BlockSet;
import io.github.eutro.funcextract.core.ir.Region;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

/**
 * Everything {@link RegionAnalyzer} found out about a region.
 */
public final class RegionAnalysis {
    public final Region region;
    public final LineBounds regionBounds;
    public final LineBounds functionBounds;
    public final BlockSet predecessors;
    public final BlockSet successors;
    public final VariableDebugInfo debugInfo;
    public final ClassificationResult classification;
    /**
     * The source lines of the region's exiting edges.
     */
    public final SortedSet<Integer> exitLines;
    /**
     * Every diagnostic produced, including those of the classification.
     */
    public final List<Diagnostic> diagnostics;

    RegionAnalysis(Region region,
                   LineBounds regionBounds,
                   LineBounds functionBounds,
                   BlockSet predecessors,
                   BlockSet successors,
                   VariableDebugInfo debugInfo,
                   ClassificationResult classification,
                   SortedSet<Integer> exitLines,
                   List<Diagnostic> diagnostics) {
        this.region = region;
        this.regionBounds = regionBounds;
        this.functionBounds = functionBounds;
        this.predecessors = predecessors;
        this.successors = successors;
        this.debugInfo = debugInfo;
        this.classification = classification;
        this.exitLines = exitLines;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }
}
