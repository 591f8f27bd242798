package io.github.eutro.funcextract.api;

/**
 * Thrown when the inputs configuring an extraction can't be read at all.
 * <p>
 * Unlike {@link io.github.eutro.funcextract.core.analysis.Diagnostic diagnostics},
 * this is fatal to the whole run.
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
