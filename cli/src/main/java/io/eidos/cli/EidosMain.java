package io.eidos.cli;

import io.eidos.core.engine.BackendRegistry;

/**
 * Entry point for the {@code eidos} command line.
 *
 * <p>
 * Delegates to {@link TranspileCommand} with every backend found on the class path and exits with
 * its status code.
 */
public final class EidosMain {

    private EidosMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments, see {@link CliOptions#USAGE}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status = new TranspileCommand(BackendRegistry.installed(), System::getenv, System.out, System.err, true)
                .run(args);
        System.exit(status);
    }
}
