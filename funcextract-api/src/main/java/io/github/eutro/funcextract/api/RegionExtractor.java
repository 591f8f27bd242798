package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.api.bits.Bit;
import io.github.eutro.funcextract.api.events.EmitReportEvent;
import io.github.eutro.funcextract.api.events.EventSupplier;
import io.github.eutro.funcextract.api.events.ExtractorEvent;
import io.github.eutro.funcextract.core.analysis.BlockSetMatcher;
import io.github.eutro.funcextract.core.analysis.Diagnostic;
import io.github.eutro.funcextract.core.analysis.RegionAnalyzer;
import io.github.eutro.funcextract.core.ir.Module;
import io.github.eutro.funcextract.core.report.ExtractionReport;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the regions named by a {@link BlockList} in submitted modules, and reports on them.
 * <p>
 * Nothing is written anywhere by default; reports are made available through
 * {@link EmitReportEvent}s, or by adding bits such as
 * {@link io.github.eutro.funcextract.api.bits.ReportsToDirectory}.
 */
public class RegionExtractor extends EventSupplier<ExtractorEvent> {
    private final BlockList blockList;
    private final RegionSource regionSource;
    private final BlockSetMatcher matcher;
    private final RegionAnalyzer analyzer;

    /**
     * Construct an extractor for the regions in a block list.
     *
     * @param blockList The block list.
     */
    public RegionExtractor(BlockList blockList) {
        this(blockList, new BlockListRegionSource(blockList), RegionAnalyzer.INSTANCE);
    }

    /**
     * Construct an extractor that matches candidate regions from any source against a block list.
     *
     * @param blockList    The block list.
     * @param regionSource Where candidate regions come from.
     * @param analyzer     The analyzer to run on matched regions.
     */
    public RegionExtractor(BlockList blockList, RegionSource regionSource, RegionAnalyzer analyzer) {
        this.blockList = blockList;
        this.regionSource = regionSource;
        this.matcher = blockList.toMatcher();
        this.analyzer = analyzer;
    }

    /**
     * Submit a module for extraction. Nothing happens until {@link ModuleExtraction#run()} is called.
     *
     * @param module The module, whose functions must all be sealed.
     * @return The extraction.
     */
    @Contract(pure = true)
    @NotNull
    public ModuleExtraction submit(Module module) {
        return new ModuleExtraction(this, module);
    }

    /**
     * Collect every report emitted by this extractor into a list.
     *
     * @return The list, which is added to as reports are emitted.
     */
    public List<ExtractionReport> reportsAsList() {
        List<ExtractionReport> reports = new ArrayList<>();
        listen(EmitReportEvent.class, evt -> reports.add(evt.report));
        return reports;
    }

    /**
     * Add a bit to this extractor.
     *
     * @param bit The bit.
     * @param <T> What the bit returns.
     * @return The result of attaching the bit.
     */
    public <T> T add(Bit<? super RegionExtractor, T> bit) {
        return bit.addTo(this);
    }

    List<Diagnostic> getBlockListDiagnostics() {
        return blockList.getDiagnostics();
    }

    RegionSource getRegionSource() {
        return regionSource;
    }

    BlockSetMatcher getMatcher() {
        return matcher;
    }

    RegionAnalyzer getAnalyzer() {
        return analyzer;
    }
}
