package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.core.debug.LineBounds;
import io.github.eutro.funcextract.core.ir.StorageLocation;
import io.github.eutro.funcextract.core.report.ExtractionReport;
import io.github.eutro.funcextract.core.report.ReportedVariable;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Writes {@link ExtractionReport}s in the {@code extractinfo} format read by the region rewriter:
 * <pre>
 * &lt;extractinfo&gt;
 *   &lt;funcname&gt;main&lt;/funcname&gt;
 *   &lt;funcreturntype&gt;int&lt;/funcreturntype&gt;
 *   &lt;region&gt;&lt;start&gt;10&lt;/start&gt;&lt;end&gt;20&lt;/end&gt;&lt;/region&gt;
 *   &lt;function&gt;&lt;start&gt;3&lt;/start&gt;&lt;end&gt;40&lt;/end&gt;&lt;/function&gt;
 *   &lt;regionexit&gt;20&lt;/regionexit&gt;
 *   &lt;variable&gt;&lt;name&gt;n&lt;/name&gt;&lt;ptrl&gt;0&lt;/ptrl&gt;&lt;type&gt;int&lt;/type&gt;&lt;/variable&gt;
 *   &lt;variable&gt;&lt;isoutput&gt;true&lt;/isoutput&gt;&lt;name&gt;head&lt;/name&gt;&lt;ptrl&gt;1&lt;/ptrl&gt;&lt;type&gt;struct Node&lt;/type&gt;&lt;/variable&gt;
 *   &lt;unknownvariable&gt;&lt;name&gt;tmp&lt;/name&gt;&lt;/unknownvariable&gt;
 * &lt;/extractinfo&gt;
 * </pre>
 * Bounds that aren't available are written as {@code <unavailable>true</unavailable>}
 * instead of a start and end.
 */
public final class ReportWriter {
    private static final XMLOutputFactory FACTORY = XMLOutputFactory.newFactory();

    private ReportWriter() {
    }

    /**
     * Write a report. The writer is flushed but not closed.
     *
     * @param report The report.
     * @param out    Where to write it.
     * @throws IOException If writing fails.
     */
    public static void write(ExtractionReport report, Writer out) throws IOException {
        try {
            XMLStreamWriter xw = FACTORY.createXMLStreamWriter(out);
            try {
                writeReport(report, xw);
                xw.flush();
            } finally {
                xw.close();
            }
        } catch (XMLStreamException e) {
            if (e.getCause() instanceof IOException) throw (IOException) e.getCause();
            throw new IOException("Failed to write report for " + report.getFunctionName(), e);
        }
        out.flush();
    }

    /**
     * Write a report to a string.
     *
     * @param report The report.
     * @return The written report.
     */
    public static String toString(ExtractionReport report) {
        StringWriter sw = new StringWriter();
        try {
            write(report, sw);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return sw.toString();
    }

    private static void writeReport(ExtractionReport report, XMLStreamWriter xw) throws XMLStreamException {
        xw.writeStartElement("extractinfo");
        newline(xw);

        indent(xw);
        leaf(xw, "funcname", report.getFunctionName());
        newline(xw);
        if (report.getReturnType().isPresent()) {
            indent(xw);
            leaf(xw, "funcreturntype", report.getReturnType().get());
            newline(xw);
        }

        indent(xw);
        bounds(xw, "region", report.getRegionBounds());
        newline(xw);
        indent(xw);
        bounds(xw, "function", report.getFunctionBounds());
        newline(xw);

        for (int line : report.getExitLines()) {
            indent(xw);
            leaf(xw, "regionexit", Integer.toString(line));
            newline(xw);
        }

        for (ReportedVariable var : report.getVariables()) {
            indent(xw);
            xw.writeStartElement("variable");
            if (var.isOutput()) leaf(xw, "isoutput", "true");
            leaf(xw, "name", var.getName());
            leaf(xw, "ptrl", Integer.toString(var.getIndirection()));
            leaf(xw, "type", var.getType());
            xw.writeEndElement();
            newline(xw);
        }

        for (StorageLocation loc : report.getUnknownLocations()) {
            indent(xw);
            xw.writeStartElement("unknownvariable");
            leaf(xw, "name", loc.getName().isEmpty() ? loc.asValue().toString() : loc.getName());
            xw.writeEndElement();
            newline(xw);
        }

        xw.writeEndElement();
        newline(xw);
    }

    private static void bounds(XMLStreamWriter xw, String name, LineBounds bounds) throws XMLStreamException {
        xw.writeStartElement(name);
        if (bounds.isEmpty()) {
            leaf(xw, "unavailable", "true");
        } else {
            leaf(xw, "start", Integer.toString(bounds.getStart()));
            leaf(xw, "end", Integer.toString(bounds.getEnd()));
        }
        xw.writeEndElement();
    }

    private static void leaf(XMLStreamWriter xw, String name, String text) throws XMLStreamException {
        xw.writeStartElement(name);
        xw.writeCharacters(text);
        xw.writeEndElement();
    }

    private static void indent(XMLStreamWriter xw) throws XMLStreamException {
        xw.writeCharacters("  ");
    }

    private static void newline(XMLStreamWriter xw) throws XMLStreamException {
        xw.writeCharacters("\n");
    }
}
