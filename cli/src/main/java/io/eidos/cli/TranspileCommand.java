package io.eidos.cli;

import io.eidos.core.engine.BackendRegistry;
import io.eidos.core.engine.TranspileEngine;
import io.eidos.core.engine.TranspileOptions;
import io.eidos.core.error.TranspileException;
import io.eidos.core.model.LanguageDefinition;
import io.eidos.core.model.SyntaxTree;
import io.eidos.core.spec.LanguageDefinitionLoader;
import io.eidos.core.spi.BackendAdapter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code eidos} command: load the language definition, then transpile every source file with
 * the selected backend, one independent pipeline run per file.
 *
 * <p>
 * Exit codes: {@code 0} success, {@code 1} a definition, source, render or write failure,
 * {@code 2} bad command line. Processing stops at the first failing file.
 */
public final class TranspileCommand {

    private static final Logger LOG = LoggerFactory.getLogger(TranspileCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final BackendRegistry backends;
    private final Function<String, String> envLookup;
    private final PrintStream out;
    private final PrintStream err;
    private final boolean configureLogging;

    public TranspileCommand(BackendRegistry backends, Function<String, String> envLookup, PrintStream out, PrintStream err) {
        this(backends, envLookup, out, err, false);
    }

    TranspileCommand(
            BackendRegistry backends,
            Function<String, String> envLookup,
            PrintStream out,
            PrintStream err,
            boolean configureLogging) {
        this.backends = Objects.requireNonNull(backends, "backends must not be null");
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.configureLogging = configureLogging;
    }

    /** Runs the command and returns the process exit code. */
    public int run(String[] args) {
        CliOptions options;
        BackendAdapter backend;
        try {
            options = CliOptions.parse(args, envLookup);
            backend = requireBackend(options.backendId());
            options.checkOutputs(backend.fileExtension());
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }

        if (configureLogging) {
            LogbackConfigurator.configure(options.logFormat(), options.logLevel());
        }

        try {
            LanguageDefinition definition = new LanguageDefinitionLoader().load(options.configPath());
            LOG.debug("Loaded language definition from {}: {}", options.configPath(), definition);
            if (options.debug()) {
                out.println("Language Config Loaded:");
                out.println(DebugDump.definition(definition));
            }

            TranspileEngine engine = new TranspileEngine(
                    definition, TranspileOptions.DEFAULT.withClosePolicy(options.closePolicy()));
            for (Path sourcePath : options.sourcePaths()) {
                transpileFile(engine, backend, options, sourcePath);
            }
            return EXIT_OK;
        } catch (TranspileException e) {
            LOG.error("{} failed for {}: {}", phaseLabel(e), e.source(), e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.error("Could not read source file: {}", e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void transpileFile(TranspileEngine engine, BackendAdapter backend, CliOptions options, Path sourcePath)
            throws IOException {
        String source = Files.readString(sourcePath, StandardCharsets.UTF_8);
        SyntaxTree tree = engine.parse(source, sourcePath.toString());
        if (options.debug()) {
            out.println("AST:");
            out.println(DebugDump.tree(tree));
        }
        FileSink sink = new FileSink(options.outputFor(sourcePath, backend.fileExtension()));
        engine.transpile(tree, backend, sink);
        out.println(backend.displayName() + " code generated in " + sink.target());
    }

    private BackendAdapter requireBackend(String backendId) {
        try {
            return backends.requireBackend(backendId);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage(), e);
        }
    }

    private static String phaseLabel(TranspileException e) {
        return switch (e.phase()) {
            case LOAD -> "Loading the language definition";
            case PARSE -> "Parsing";
            case RENDER -> "Rendering";
            case OUTPUT -> "Writing output";
        };
    }
}
