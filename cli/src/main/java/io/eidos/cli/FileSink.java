package io.eidos.cli;

import io.eidos.core.spi.OutputSink;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Writes the generated program to a file as UTF-8, creating parent directories as needed. */
public final class FileSink implements OutputSink {

    private final Path target;

    public FileSink(Path target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    public Path target() {
        return target;
    }

    @Override
    public void write(String program) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, program, StandardCharsets.UTF_8);
    }
}
