package io.eidos.core.error;

/**
 * Thrown when a language definition cannot be loaded: missing or unreadable file, invalid YAML or
 * JSON, schema violations, or empty match patterns. Always fatal: parsing never starts.
 */
public final class ConfigLoadException extends TranspileException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message, String source) {
        super(message, Phase.LOAD, source);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD, source);
    }
}
