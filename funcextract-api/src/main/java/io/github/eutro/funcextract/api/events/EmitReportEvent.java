package io.github.eutro.funcextract.api.events;

import io.github.eutro.funcextract.api.ModuleExtraction;
import io.github.eutro.funcextract.core.ir.Region;
import io.github.eutro.funcextract.core.report.ExtractionReport;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when the report of a matched region should be emitted.
 *
 * @see ModuleExtraction
 */
public class EmitReportEvent implements ExtractorEvent, CancellableEvent {
    /**
     * The region that was analysed.
     */
    @NotNull
    public final Region region;
    /**
     * The report to be emitted.
     */
    @NotNull
    public ExtractionReport report;
    private boolean cancelled = false;

    public EmitReportEvent(@NotNull Region region, @NotNull ExtractionReport report) {
        this.region = region;
        this.report = report;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
