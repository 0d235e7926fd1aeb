package io.eidos.core.error;

/**
 * Abstract base for all eidos pipeline errors. Never thrown directly; use one of the concrete
 * subclasses. Every error carries the pipeline {@link Phase} it was raised in and the name of the
 * definition file or source document being processed.
 */
public abstract class TranspileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage in which the error occurred. */
    public enum Phase {
        LOAD,
        PARSE,
        RENDER,
        OUTPUT
    }

    private final Phase phase;
    private final String source;

    protected TranspileException(String message, Phase phase, String source) {
        super(message);
        this.phase = phase;
        this.source = source;
    }

    protected TranspileException(String message, Throwable cause, Phase phase, String source) {
        super(message, cause);
        this.phase = phase;
        this.source = source;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** The definition file, source document or sink involved, or {@code null} if unknown. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
