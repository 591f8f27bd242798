package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.core.analysis.Diagnostic;
import io.github.eutro.funcextract.core.ir.Function;
import io.github.eutro.funcextract.core.ir.Region;

import java.util.List;
import java.util.function.Consumer;

/**
 * Supplies the candidate regions of a function, which are then matched against what was asked for.
 */
@FunctionalInterface
public interface RegionSource {
    /**
     * Get the candidate regions of a function.
     *
     * @param func        The function, which is sealed.
     * @param diagnostics Where to report problems building the candidates.
     * @return The candidates.
     */
    List<Region> regionsOf(Function func, Consumer<Diagnostic> diagnostics);
}
