package io.github.eutro.funcextract.api.bits;

import io.github.eutro.funcextract.api.ReportWriter;
import io.github.eutro.funcextract.api.events.EmitReportEvent;
import io.github.eutro.funcextract.api.events.EventSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A bit which writes emitted reports to the given directory, as {@code <function>.extractinfo.xml}.
 * <p>
 * A later report for the same function replaces the earlier one.
 *
 * @param <T> The type on which this listens to events.
 */
public class ReportsToDirectory<T extends EventSupplier<? super EmitReportEvent>>
        implements Bit<T, Void> {
    /**
     * The suffix of report files.
     */
    public static final String SUFFIX = ".extractinfo.xml";

    private static final Logger log = LoggerFactory.getLogger(ReportsToDirectory.class);

    private final Path directory;

    /**
     * Construct a {@link ReportsToDirectory} for writing to the given directory.
     *
     * @param directory The directory to write reports to. It is created if it doesn't exist.
     */
    public ReportsToDirectory(Path directory) {
        this.directory = directory;
    }

    @Override
    public Void addTo(T ex) {
        ex.listen(EmitReportEvent.class, evt -> {
            Path file = directory.resolve(evt.report.getFunctionName() + SUFFIX);
            try {
                Files.createDirectories(directory);
                try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                    ReportWriter.write(evt.report, writer);
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            log.info("Wrote {}", file);
        });
        return null;
    }
}
