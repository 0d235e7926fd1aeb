package io.eidos.cli;

/** Thrown when the command line cannot be understood. The CLI prints usage and exits with 2. */
public class UsageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
