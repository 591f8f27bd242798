package io.github.eutro.funcextract.api.events;

import io.github.eutro.funcextract.api.ModuleExtraction;
import io.github.eutro.funcextract.core.ir.Region;
import org.jetbrains.annotations.NotNull;

/**
 * Fired for every candidate region, before it is matched. Cancelling it skips the region.
 *
 * @see ModuleExtraction
 */
public class RegionVisitEvent implements ExtractorEvent, CancellableEvent {
    /**
     * The candidate region.
     */
    @NotNull
    public final Region region;
    private boolean cancelled = false;

    public RegionVisitEvent(@NotNull Region region) {
        this.region = region;
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
