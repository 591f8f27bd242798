package io.github.eutro.funcextract.core.analysis;

import io.github.eutro.funcextract.core.debug.LineBounds;
import io.github.eutro.funcextract.core.debug.VariableDebugInfo;
import io.github.eutro.funcextract.core.ir.BlockSet;
import io.github.eutro.funcextract.core.ir.Function;
import io.github.eutro.funcextract.core.ir.Region;
import io.github.eutro.funcextract.core.passes.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the boundary analyses on a region:
 * <ol>
 *     <li>the region's and function's line bounds are computed;</li>
 *     <li>the predecessor and successor block sets are computed;</li>
 *     <li>the debug variables of the function are collected;</li>
 *     <li>the touched storage locations are {@link ScopeClassifier classified};</li>
 *     <li>the region's exits are found.</li>
 * </ol>
 * Every run starts from scratch, so analysing one region never affects another.
 */
public class RegionAnalyzer implements IRPass<Region, RegionAnalysis> {
    /**
     * An analyzer that collects debug variables with {@link CollectVariableDebugInfo}.
     */
    public static final RegionAnalyzer INSTANCE = new RegionAnalyzer(CollectVariableDebugInfo.INSTANCE);

    private final IRPass<Function, VariableDebugInfo> debugInfoSource;

    /**
     * Construct an analyzer.
     *
     * @param debugInfoSource Where to get the variables storage locations were declared as.
     */
    public RegionAnalyzer(IRPass<Function, VariableDebugInfo> debugInfoSource) {
        this.debugInfoSource = debugInfoSource;
    }

    @Override
    public RegionAnalysis run(Region region) {
        Function func = region.getFunction();
        List<Diagnostic> diagnostics = new ArrayList<>();

        LineBounds regionBounds = ComputeRegionBounds.INSTANCE.run(region);
        if (regionBounds.isEmpty() && !region.getBlocks().isEmpty()) {
            diagnostics.add(new Diagnostic(Diagnostic.Kind.MISSING_DEBUG_INFO,
                    "Region " + region + " has no debug locations"));
        }
        LineBounds functionBounds = ComputeFunctionBounds.INSTANCE.run(func);
        if (functionBounds.isEmpty()) {
            diagnostics.add(new Diagnostic(Diagnostic.Kind.MISSING_DEBUG_INFO,
                    "Function " + func.getName() + " has no subprogram"));
        }

        BlockSet predecessors = BlockClosure.predecessorsOf(region);
        BlockSet successors = BlockClosure.successorsOf(region);

        VariableDebugInfo debugInfo = debugInfoSource.run(func);
        ClassificationResult classification = new ScopeClassifier(debugInfo)
                .classify(region, predecessors, successors, regionBounds);
        diagnostics.addAll(classification.getDiagnostics());

        return new RegionAnalysis(
                region,
                regionBounds,
                functionBounds,
                predecessors,
                successors,
                debugInfo,
                classification,
                FindRegionExits.INSTANCE.run(region),
                diagnostics
        );
    }
}
