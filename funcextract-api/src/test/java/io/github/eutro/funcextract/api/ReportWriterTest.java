package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.core.analysis.RegionAnalyzer;
import io.github.eutro.funcextract.core.debug.LineBounds;
import io.github.eutro.funcextract.core.ir.*;
import io.github.eutro.funcextract.core.ir.Module;
import io.github.eutro.funcextract.core.report.ExtractionReport;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class ReportWriterTest {
    @Test
    void testWrite() {
        Countdown cd = new Countdown();
        Region loop = Region.of(cd.countdown, Arrays.asList("while.cond", "while.body"));
        ExtractionReport report = ExtractionReport.of(RegionAnalyzer.INSTANCE.run(loop));

        assertEquals("<extractinfo>\n" +
                        "  <funcname>countdown</funcname>\n" +
                        "  <funcreturntype>int</funcreturntype>\n" +
                        "  <region><start>5</start><end>8</end></region>\n" +
                        "  <function><start>1</start><end>10</end></function>\n" +
                        "  <regionexit>5</regionexit>\n" +
                        "  <variable><name>left</name><ptrl>0</ptrl><type>int</type></variable>\n" +
                        "  <variable><name>steps</name><ptrl>0</ptrl><type>int</type></variable>\n" +
                        "  <variable><isoutput>true</isoutput><name>last</name><ptrl>0</ptrl><type>int</type></variable>\n" +
                        "</extractinfo>\n",
                ReportWriter.toString(report));
    }

    @Test
    void testUnavailableAndUnknown() {
        Module module = new Module("stub.c");
        GlobalVariable global = module.newGlobal("g<1");
        ExtractionReport report = new ExtractionReport(
                "stub",
                null,
                LineBounds.EMPTY,
                LineBounds.EMPTY,
                new TreeSet<>(),
                Collections.emptyList(),
                Collections.singletonList(global),
                Collections.emptyList()
        );

        assertEquals("<extractinfo>\n" +
                        "  <funcname>stub</funcname>\n" +
                        "  <region><unavailable>true</unavailable></region>\n" +
                        "  <function><unavailable>true</unavailable></function>\n" +
                        "  <unknownvariable><name>g&lt;1</name></unknownvariable>\n" +
                        "</extractinfo>\n",
                ReportWriter.toString(report));
    }
}
