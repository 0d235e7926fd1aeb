package io.eidos.core.error;

/** Thrown when rendered output could not be delivered to its sink. */
public final class SinkException extends TranspileException {

    private static final long serialVersionUID = 1L;

    public SinkException(String message, String source) {
        super(message, Phase.OUTPUT, source);
    }

    public SinkException(String message, Throwable cause, String source) {
        super(message, cause, Phase.OUTPUT, source);
    }
}
