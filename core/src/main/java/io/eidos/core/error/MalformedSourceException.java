package io.eidos.core.error;

/**
 * Thrown when the structure of a source document is broken, e.g. a block is still open when the
 * input ends. Carries the 1-based line number of the offending line.
 */
public final class MalformedSourceException extends TranspileException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final String ruleName;

    public MalformedSourceException(String message, String source, int lineNumber, String ruleName) {
        super(message, Phase.PARSE, source);
        this.lineNumber = lineNumber;
        this.ruleName = ruleName;
    }

    /** 1-based line number in the original source. */
    public int lineNumber() {
        return lineNumber;
    }

    /** The block rule involved, or {@code null}. */
    public String ruleName() {
        return ruleName;
    }
}
