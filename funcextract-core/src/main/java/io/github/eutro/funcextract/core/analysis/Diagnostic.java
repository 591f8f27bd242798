package io.github.eutro.funcextract.core.analysis;

import java.util.Objects;

/**
 * A recoverable problem found while analysing a region. Diagnostics degrade the
 * result of an analysis but never abort it.
 */
public final class Diagnostic {
    /**
     * What went wrong.
     */
    public enum Kind {
        /**
         * The block list or a candidate region was not what was expected.
         */
        MALFORMED_INPUT,
        /**
         * A storage location or function has no debug descriptor.
         */
        MISSING_DEBUG_INFO,
        /**
         * A type descriptor chain could not be resolved.
         */
        MALFORMED_TYPE_METADATA,
    }

    private final Kind kind;
    private final String message;

    public Diagnostic(Kind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
