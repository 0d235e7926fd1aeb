package io.eidos.cli;

import io.eidos.core.engine.ClosePolicy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Resolved command-line settings.
 *
 * <p>
 * Settings not given on the command line fall back to environment variables, then to defaults.
 * An env var counts as set only if it is defined and non-blank after trimming.
 *
 * <table>
 * <caption>Environment fallbacks</caption>
 * <tr><th>Option</th><th>Env var</th><th>Default</th></tr>
 * <tr><td>{@code --backend}</td><td>{@code EIDOS_BACKEND}</td><td>{@code c}</td></tr>
 * <tr><td>{@code --close-policy}</td><td>{@code EIDOS_CLOSE_POLICY}</td><td>{@code any}</td></tr>
 * <tr><td>{@code --output-dir}</td><td>{@code EIDOS_OUTPUT_DIR}</td><td>current directory</td></tr>
 * <tr><td>{@code --log-format}</td><td>{@code EIDOS_LOG_FORMAT}</td><td>{@code text}</td></tr>
 * <tr><td>{@code --log-level}</td><td>{@code EIDOS_LOG_LEVEL}</td><td>{@code INFO} ({@code DEBUG} with {@code -d})</td></tr>
 * </table>
 */
public record CliOptions(
        boolean debug,
        String backendId,
        ClosePolicy closePolicy,
        Path configPath,
        List<Path> sourcePaths,
        Path output,
        Path outputDir,
        String logFormat,
        String logLevel) {

    public static final String USAGE = "Usage: eidos [-d] [--backend <id>] [--close-policy any|matching]"
            + " [--output <file>] [--output-dir <dir>] [--log-format text|json] [--log-level <level>]"
            + " <config_file> <source_file>...";

    static final String DEFAULT_BACKEND = "c";
    static final String DEFAULT_OUTPUT_STEM = "output";

    public CliOptions {
        Objects.requireNonNull(backendId, "backendId must not be null");
        Objects.requireNonNull(closePolicy, "closePolicy must not be null");
        Objects.requireNonNull(configPath, "configPath must not be null");
        sourcePaths = List.copyOf(sourcePaths);
        Objects.requireNonNull(outputDir, "outputDir must not be null");
    }

    /**
     * Parses command-line arguments, consulting {@code envLookup} for unset options.
     *
     * @throws UsageException if arguments are missing, unknown or inconsistent
     */
    public static CliOptions parse(String[] args, Function<String, String> envLookup) {
        boolean debug = false;
        String backend = null;
        String closePolicy = null;
        String output = null;
        String outputDir = null;
        String logFormat = null;
        String logLevel = null;
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-d", "--debug" -> debug = true;
                case "--backend" -> backend = value(args, ++i, arg);
                case "--close-policy" -> closePolicy = value(args, ++i, arg);
                case "--output" -> output = value(args, ++i, arg);
                case "--output-dir" -> outputDir = value(args, ++i, arg);
                case "--log-format" -> logFormat = value(args, ++i, arg);
                case "--log-level" -> logLevel = value(args, ++i, arg);
                default -> {
                    if (arg.startsWith("--")) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }

        if (positional.size() < 2) {
            throw new UsageException("Expected a config file and at least one source file");
        }
        if (output != null && positional.size() > 2) {
            throw new UsageException("--output accepts a single source file; use --output-dir for several");
        }

        ClosePolicy policy;
        try {
            policy = ClosePolicy.fromConfig(orEnv(closePolicy, envLookup, "EIDOS_CLOSE_POLICY", "any"));
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage(), e);
        }

        List<Path> sources = new ArrayList<>();
        for (String source : positional.subList(1, positional.size())) {
            sources.add(Path.of(source));
        }

        return new CliOptions(
                debug,
                orEnv(backend, envLookup, "EIDOS_BACKEND", DEFAULT_BACKEND),
                policy,
                Path.of(positional.get(0)),
                sources,
                output != null ? Path.of(output) : null,
                Path.of(orEnv(outputDir, envLookup, "EIDOS_OUTPUT_DIR", "")),
                orEnv(logFormat, envLookup, "EIDOS_LOG_FORMAT", "text"),
                orEnv(logLevel, envLookup, "EIDOS_LOG_LEVEL", debug ? "DEBUG" : "INFO"));
    }

    /**
     * Where the program generated from {@code source} is written: {@code --output} if given,
     * otherwise {@code output.<ext>} for a single source and {@code <stem>.<ext>} for several, in
     * the output directory.
     */
    public Path outputFor(Path source, String extension) {
        if (output != null) {
            return output;
        }
        String stem = DEFAULT_OUTPUT_STEM;
        if (sourcePaths.size() > 1) {
            String fileName = source.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        }
        return outputDir.resolve(stem + "." + extension);
    }

    /**
     * Rejects a run in which two sources would be written to the same file, or in which an output
     * would overwrite the config file or a source. Paths are compared after normalizing them
     * against the working directory.
     *
     * @param extension file extension of the selected backend
     * @throws UsageException naming the conflicting paths
     */
    public void checkOutputs(String extension) {
        Set<Path> inputs = new HashSet<>();
        inputs.add(normalized(configPath));
        for (Path source : sourcePaths) {
            inputs.add(normalized(source));
        }

        Map<Path, Path> claimed = new HashMap<>();
        for (Path source : sourcePaths) {
            Path target = outputFor(source, extension);
            Path key = normalized(target);
            if (inputs.contains(key)) {
                throw new UsageException("Output " + target + " would overwrite input file " + key);
            }
            Path previous = claimed.putIfAbsent(key, source);
            if (previous != null) {
                throw new UsageException(previous + " and " + source + " would both be written to " + target);
            }
        }
    }

    private static Path normalized(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new UsageException(option + " requires a value");
        }
        return args[index];
    }

    private static String orEnv(String explicit, Function<String, String> envLookup, String envVar, String fallback) {
        if (explicit != null) {
            return explicit;
        }
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty() ? value.trim() : fallback;
    }
}
