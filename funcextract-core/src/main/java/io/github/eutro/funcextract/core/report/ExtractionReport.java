package io.github.eutro.funcextract.core.report;

import io.github.eutro.funcextract.core.analysis.*;
import io.github.eutro.funcextract.core.debug.*;
import io.github.eutro.funcextract.core.ir.Function;
import io.github.eutro.funcextract.core.ir.StorageLocation;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * What a rewriter needs to know to outline a region: where the region and its function are,
 * where the region exits, and which variables cross its boundary.
 * <p>
 * Inputs are listed before outputs, each ordered by declaration line and then name.
 * A location that is both an input and an output appears twice.
 */
public final class ExtractionReport {
    private static final Comparator<ReportedVariable> BY_DECLARATION = Comparator
            .comparingInt(ReportedVariable::getDeclarationLine)
            .thenComparing(ReportedVariable::getName)
            .thenComparingInt(it -> it.getLocation().asValue().getId());

    private final String functionName;
    private final @Nullable String returnType;
    private final LineBounds regionBounds;
    private final LineBounds functionBounds;
    private final SortedSet<Integer> exitLines;
    private final List<ReportedVariable> variables;
    private final List<StorageLocation> unknownLocations;
    private final List<Diagnostic> diagnostics;

    public ExtractionReport(String functionName,
                            @Nullable String returnType,
                            LineBounds regionBounds,
                            LineBounds functionBounds,
                            SortedSet<Integer> exitLines,
                            List<ReportedVariable> variables,
                            List<StorageLocation> unknownLocations,
                            List<Diagnostic> diagnostics) {
        this.functionName = functionName;
        this.returnType = returnType;
        this.regionBounds = regionBounds;
        this.functionBounds = functionBounds;
        this.exitLines = Collections.unmodifiableSortedSet(new TreeSet<>(exitLines));
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.unknownLocations = Collections.unmodifiableList(new ArrayList<>(unknownLocations));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    /**
     * Build the report of an analysed region, resolving the types of its variables.
     * <p>
     * Type chains that can't be resolved are reported as {@code unknown}, with a diagnostic.
     *
     * @param analysis The analysis.
     * @return The report.
     */
    public static ExtractionReport of(RegionAnalysis analysis) {
        Function func = analysis.region.getFunction();
        List<Diagnostic> diagnostics = new ArrayList<>(analysis.diagnostics);
        ClassificationResult result = analysis.classification;

        List<ReportedVariable> inputs = new ArrayList<>();
        for (StorageLocation loc : result.getInputs()) {
            inputs.add(reportVariable(analysis.debugInfo, loc, false, diagnostics));
        }
        inputs.sort(BY_DECLARATION);
        List<ReportedVariable> outputs = new ArrayList<>();
        for (StorageLocation loc : result.getOutputs()) {
            outputs.add(reportVariable(analysis.debugInfo, loc, true, diagnostics));
        }
        outputs.sort(BY_DECLARATION);
        List<ReportedVariable> variables = new ArrayList<>(inputs);
        variables.addAll(outputs);

        String returnType = null;
        DISubprogram subprogram = func.getExt(DebugExts.SUBPROGRAM).orElse(null);
        if (subprogram != null && subprogram.getReturnType() != null) {
            returnType = renderDeclaredType(subprogram.getReturnType(), diagnostics);
        }

        return new ExtractionReport(
                func.getName(),
                returnType,
                analysis.regionBounds,
                analysis.functionBounds,
                analysis.exitLines,
                variables,
                new ArrayList<>(result.getUnknown()),
                diagnostics
        );
    }

    private static ReportedVariable reportVariable(VariableDebugInfo debugInfo,
                                                   StorageLocation loc,
                                                   boolean output,
                                                   List<Diagnostic> diagnostics) {
        DIVariable var = debugInfo.lookup(loc)
                .orElseThrow(() -> new IllegalStateException("Classified " + loc.asValue() + " has no variable"));
        String type = "unknown";
        int indirection = 0;
        if (var.getType() != null) {
            try {
                ResolvedType resolved = TypeResolver.resolveBaseType(var.getType());
                type = resolved.getTypeName();
                indirection = resolved.getIndirection();
            } catch (MalformedTypeMetadataException e) {
                diagnostics.add(new Diagnostic(Diagnostic.Kind.MALFORMED_TYPE_METADATA,
                        "Variable " + var.getName() + ": " + e.getMessage()));
            }
        }
        return new ReportedVariable(loc, var.getName(), var.getLine(), output, indirection, type);
    }

    private static String renderDeclaredType(DIType type, List<Diagnostic> diagnostics) {
        try {
            ResolvedType resolved = TypeResolver.resolveBaseType(type);
            if (resolved.getIndirection() == 0) return resolved.getTypeName();
            return resolved.getTypeName() + " " + "*".repeat(resolved.getIndirection());
        } catch (MalformedTypeMetadataException e) {
            diagnostics.add(new Diagnostic(Diagnostic.Kind.MALFORMED_TYPE_METADATA,
                    "Return type: " + e.getMessage()));
            return "unknown";
        }
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * Get the return type of the function, as it would be written in source.
     *
     * @return The return type, or empty if the function has none or it isn't known.
     */
    public Optional<String> getReturnType() {
        return Optional.ofNullable(returnType);
    }

    public LineBounds getRegionBounds() {
        return regionBounds;
    }

    /**
     * Get the lines the whole function spans.
     *
     * @return The bounds, which are {@link LineBounds#EMPTY empty} if the function has no subprogram.
     */
    public LineBounds getFunctionBounds() {
        return functionBounds;
    }

    public SortedSet<Integer> getExitLines() {
        return exitLines;
    }

    public List<ReportedVariable> getVariables() {
        return variables;
    }

    public List<StorageLocation> getUnknownLocations() {
        return unknownLocations;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "ExtractionReport{" + functionName + ", region=" + regionBounds + ", variables=" + variables + "}";
    }
}
