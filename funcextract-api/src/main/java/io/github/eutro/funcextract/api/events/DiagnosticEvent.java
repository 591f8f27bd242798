package io.github.eutro.funcextract.api.events;

import io.github.eutro.funcextract.core.analysis.Diagnostic;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Fired for every diagnostic produced during an extraction.
 */
public class DiagnosticEvent implements ExtractorEvent {
    /**
     * The diagnostic.
     */
    @NotNull
    public final Diagnostic diagnostic;
    /**
     * The name of the function being extracted from, or null if it came from the block list.
     */
    @Nullable
    public final String function;

    public DiagnosticEvent(@NotNull Diagnostic diagnostic, @Nullable String function) {
        this.diagnostic = diagnostic;
        this.function = function;
    }
}
