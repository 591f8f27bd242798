package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.api.events.DiagnosticEvent;
import io.github.eutro.funcextract.api.events.EmitReportEvent;
import io.github.eutro.funcextract.api.events.RegionVisitEvent;
import io.github.eutro.funcextract.core.analysis.Diagnostic;
import io.github.eutro.funcextract.core.analysis.RegionAnalysis;
import io.github.eutro.funcextract.core.ir.Function;
import io.github.eutro.funcextract.core.ir.Module;
import io.github.eutro.funcextract.core.ir.Region;
import io.github.eutro.funcextract.core.report.ExtractionReport;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The extraction of regions from a single module.
 * <p>
 * Extraction, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>A {@link DiagnosticEvent} is fired for every problem found in the block list.</li>
 *     <li>For every function, the candidate regions are taken from the {@link RegionSource}.</li>
 *     <li>For every candidate, {@link RegionVisitEvent} is fired. If it is cancelled the candidate is skipped.</li>
 *     <li>Candidates that don't exactly match the block list are skipped.</li>
 *     <li>Each matched region is analysed from scratch, and a report is built.</li>
 *     <li>A {@link DiagnosticEvent} is fired for every diagnostic of the report.</li>
 *     <li>{@link EmitReportEvent} is fired.</li>
 * </ol>
 * All events are fired on the {@link RegionExtractor extractor}.
 */
public class ModuleExtraction {
    private static final Logger log = LoggerFactory.getLogger(ModuleExtraction.class);

    private final RegionExtractor ex;

    /**
     * The module being extracted from.
     */
    @NotNull
    public final Module module;

    ModuleExtraction(RegionExtractor ex, @NotNull Module module) {
        this.ex = ex;
        this.module = module;
    }

    /**
     * Run the extraction.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The reports that were emitted, in the order they were emitted.
     */
    public List<ExtractionReport> run() {
        for (Diagnostic diagnostic : ex.getBlockListDiagnostics()) {
            ex.dispatch(DiagnosticEvent.class, new DiagnosticEvent(diagnostic, null));
        }

        List<ExtractionReport> emitted = new ArrayList<>();
        for (Function func : module.getFunctions()) {
            List<Region> candidates = ex.getRegionSource().regionsOf(func, diagnostic ->
                    ex.dispatch(DiagnosticEvent.class, new DiagnosticEvent(diagnostic, func.getName())));
            for (Region region : candidates) {
                if (ex.dispatch(RegionVisitEvent.class, new RegionVisitEvent(region)).isCancelled()) {
                    log.debug("Visit of {} cancelled", region);
                    continue;
                }
                if (!ex.getMatcher().matches(region)) {
                    log.debug("Region {} is not a target, skipping", region);
                    continue;
                }

                log.info("Analysing region {}", region);
                RegionAnalysis analysis = ex.getAnalyzer().run(region);
                ExtractionReport report = ExtractionReport.of(analysis);
                for (Diagnostic diagnostic : report.getDiagnostics()) {
                    ex.dispatch(DiagnosticEvent.class, new DiagnosticEvent(diagnostic, func.getName()));
                }

                EmitReportEvent evt = ex.dispatch(EmitReportEvent.class, new EmitReportEvent(region, report));
                if (evt.isCancelled()) {
                    log.debug("Report for {} cancelled", region);
                } else {
                    emitted.add(evt.report);
                }
            }
        }
        log.info("Extracted {} region(s) from module {}", emitted.size(), module.getName());
        return emitted;
    }
}
