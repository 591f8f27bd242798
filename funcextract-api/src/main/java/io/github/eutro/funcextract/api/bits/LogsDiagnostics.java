package io.github.eutro.funcextract.api.bits;

import io.github.eutro.funcextract.api.events.DiagnosticEvent;
import io.github.eutro.funcextract.api.events.EventSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A bit which logs every diagnostic as a warning.
 *
 * @param <T> The type on which this listens to events.
 */
public class LogsDiagnostics<T extends EventSupplier<? super DiagnosticEvent>>
        implements Bit<T, Void> {
    private final Logger logger;

    /**
     * Log to the logger of this class.
     */
    public LogsDiagnostics() {
        this(LoggerFactory.getLogger(LogsDiagnostics.class));
    }

    public LogsDiagnostics(Logger logger) {
        this.logger = logger;
    }

    @Override
    public Void addTo(T ex) {
        ex.listen(DiagnosticEvent.class, evt -> {
            if (evt.function == null) {
                logger.warn("{}", evt.diagnostic);
            } else {
                logger.warn("In {}: {}", evt.function, evt.diagnostic);
            }
        });
        return null;
    }
}
