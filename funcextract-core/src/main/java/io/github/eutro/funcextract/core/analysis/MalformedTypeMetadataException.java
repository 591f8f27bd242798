package io.github.eutro.funcextract.core.analysis;

/**
 * Thrown when a type descriptor chain is too deep to be well-formed debug information,
 * which usually means it is cyclic.
 */
public class MalformedTypeMetadataException extends RuntimeException {
    public MalformedTypeMetadataException(String message) {
        super(message);
    }
}
