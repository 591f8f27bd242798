package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.api.bits.LogsDiagnostics;
import io.github.eutro.funcextract.api.bits.ReportsToDirectory;
import io.github.eutro.funcextract.api.events.DiagnosticEvent;
import io.github.eutro.funcextract.api.events.EmitReportEvent;
import io.github.eutro.funcextract.api.events.RegionVisitEvent;
import io.github.eutro.funcextract.core.analysis.Diagnostic;
import io.github.eutro.funcextract.core.analysis.RegionAnalyzer;
import io.github.eutro.funcextract.core.ir.Region;
import io.github.eutro.funcextract.core.report.ExtractionReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class RegionExtractorTest {
    static BlockList blocks(String... lines) {
        return BlockListReader.parse(Arrays.asList(lines));
    }

    @Test
    void testExtract() {
        RegionExtractor ex = new RegionExtractor(blocks("!countdown", "while.cond", "while.body"));
        List<ExtractionReport> collected = ex.reportsAsList();
        List<ExtractionReport> reports = ex.submit(new Countdown().module).run();

        assertEquals(1, reports.size());
        assertEquals(reports, collected);
        ExtractionReport report = reports.get(0);
        assertEquals("countdown", report.getFunctionName());
        assertEquals(3, report.getVariables().size());
        assertTrue(report.getVariables().get(2).isOutput());
        assertEquals("last", report.getVariables().get(2).getName());
    }

    @Test
    void testPartialMatchesAreSkipped() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        RegionExtractor ex = new RegionExtractor(blocks("!countdown", "while.cond", "if.then"));
        ex.listen(DiagnosticEvent.class, evt -> diagnostics.add(evt.diagnostic));

        assertTrue(ex.submit(new Countdown().module).run().isEmpty());
        assertEquals(1, diagnostics.size());
        assertEquals(Diagnostic.Kind.MALFORMED_INPUT, diagnostics.get(0).getKind());
        assertTrue(diagnostics.get(0).getMessage().contains("if.then"));
    }

    @Test
    void testOtherSources() {
        Countdown cd = new Countdown();
        // every single block is a candidate, only the listed one matches
        RegionSource singleBlocks = (func, diagnostics) -> {
            List<Region> regions = new ArrayList<>();
            func.getBlocks().forEach(block ->
                    regions.add(Region.of(func, Collections.singletonList(block.getName()))));
            return regions;
        };
        List<Region> visited = new ArrayList<>();
        RegionExtractor ex = new RegionExtractor(blocks("!countdown", "while.body"), singleBlocks, RegionAnalyzer.INSTANCE);
        ex.listen(RegionVisitEvent.class, evt -> visited.add(evt.region));

        List<ExtractionReport> reports = ex.submit(cd.module).run();
        assertEquals(5, visited.size());
        assertEquals(1, reports.size());
        assertEquals(Collections.singleton(8), reports.get(0).getExitLines());
    }

    @Test
    void testCancellation() {
        Countdown cd = new Countdown();
        RegionExtractor ex = new RegionExtractor(blocks("!countdown", "while.cond", "while.body", "!helper", "entry"));
        ex.listen(RegionVisitEvent.class, evt -> {
            if (evt.region.getFunction() == cd.countdown) evt.cancel();
        });
        List<ExtractionReport> reports = ex.submit(cd.module).run();
        assertEquals(1, reports.size());
        assertEquals("helper", reports.get(0).getFunctionName());

        RegionExtractor quiet = new RegionExtractor(blocks("!helper", "entry"));
        List<ExtractionReport> seen = new ArrayList<>();
        quiet.listen(EmitReportEvent.class, EmitReportEvent::cancel);
        quiet.listen(EmitReportEvent.class, evt -> seen.add(evt.report));
        assertTrue(quiet.submit(new Countdown().module).run().isEmpty());
        assertTrue(seen.isEmpty());
    }

    @Test
    void testBlockListDiagnostics() {
        List<DiagnosticEvent> events = new ArrayList<>();
        RegionExtractor ex = new RegionExtractor(blocks("stray", "!helper", "entry"));
        ex.add(new LogsDiagnostics<>());
        ex.listen(DiagnosticEvent.class, events::add);

        assertEquals(1, ex.submit(new Countdown().module).run().size());
        assertEquals(1, events.size());
        assertNull(events.get(0).function);
        assertEquals(Diagnostic.Kind.MALFORMED_INPUT, events.get(0).diagnostic.getKind());
    }

    @Test
    void testReportsToDirectory(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("reports");
        RegionExtractor ex = new RegionExtractor(blocks("!countdown", "while.cond", "while.body", "!helper", "entry"));
        ex.add(new ReportsToDirectory<>(out));
        ex.submit(new Countdown().module).run();

        Path countdown = out.resolve("countdown" + ReportsToDirectory.SUFFIX);
        Path helper = out.resolve("helper.extractinfo.xml");
        assertTrue(Files.isRegularFile(countdown));
        assertTrue(Files.isRegularFile(helper));
        String xml = new String(Files.readAllBytes(countdown), StandardCharsets.UTF_8);
        assertTrue(xml.startsWith("<extractinfo>"));
        assertTrue(xml.contains("<variable><isoutput>true</isoutput><name>last</name>"));
        assertTrue(new String(Files.readAllBytes(helper), StandardCharsets.UTF_8)
                .contains("<regionexit>12</regionexit>"));
    }
}
