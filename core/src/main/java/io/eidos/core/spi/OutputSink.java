package io.eidos.core.spi;

import java.io.IOException;

/**
 * Receives the finished program text of one transpile run and persists it. The engine turns any
 * {@link IOException} into a {@code SinkException}.
 */
@FunctionalInterface
public interface OutputSink {

    void write(String program) throws IOException;
}
