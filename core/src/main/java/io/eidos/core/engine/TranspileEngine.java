package io.eidos.core.engine;

import io.eidos.core.error.SinkException;
import io.eidos.core.model.LanguageDefinition;
import io.eidos.core.model.SyntaxTree;
import io.eidos.core.spi.BackendAdapter;
import io.eidos.core.spi.OutputSink;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Facade over the parse and render stages for one language definition.
 *
 * <p>
 * {@code definition → parse(source) → render(tree, backend) → backend.wrap(body) → sink}. Every
 * call owns its parse stack and render context, so one engine can transpile any number of
 * documents, one after another or from several threads, without state leaking between them.
 *
 * <p>
 * Errors are never recovered here: {@code MalformedSourceException}, {@code UnknownRuleException}
 * and {@link SinkException} propagate to the caller unchanged.
 */
public final class TranspileEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TranspileEngine.class);

    /** MDC key holding the name of the document being transpiled. */
    static final String MDC_SOURCE = "source";

    private final LanguageDefinition definition;
    private final TranspileOptions options;
    private final TreeBuilder treeBuilder;
    private final TemplateRenderer renderer;

    public TranspileEngine(LanguageDefinition definition, TranspileOptions options) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.treeBuilder = new TreeBuilder(definition, options.closePolicy());
        this.renderer = new TemplateRenderer(options.indentUnit());
    }

    public TranspileEngine(LanguageDefinition definition) {
        this(definition, TranspileOptions.DEFAULT);
    }

    public LanguageDefinition definition() {
        return definition;
    }

    public TranspileOptions options() {
        return options;
    }

    /** Parses {@code source} into a syntax tree bound to this engine's definition. */
    public SyntaxTree parse(String source, String sourceName) {
        return treeBuilder.build(source, sourceName);
    }

    /**
     * Renders a parsed tree at the backend's body depth, applying the backend's render hook. The
     * result is the body only; it is not wrapped in the program skeleton.
     */
    public String render(SyntaxTree tree, BackendAdapter backend) {
        Objects.requireNonNull(backend, "backend must not be null");
        return renderer.render(tree, backend.bodyDepth(), backend.renderHook());
    }

    /**
     * Runs the full pipeline for one document and returns the complete program.
     *
     * @param source     raw source text
     * @param sourceName document name for diagnostics
     * @param backend    target backend
     * @return program text, wrapped in the backend's skeleton
     */
    public String transpile(String source, String sourceName, BackendAdapter backend) {
        Objects.requireNonNull(backend, "backend must not be null");
        MDC.put(MDC_SOURCE, String.valueOf(sourceName));
        try {
            long start = System.nanoTime();
            return complete(parse(source, sourceName), backend, start);
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }

    /**
     * Renders and wraps a tree that was already parsed, for callers that inspect the tree first.
     *
     * @return program text, wrapped in the backend's skeleton
     */
    public String transpile(SyntaxTree tree, BackendAdapter backend) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(backend, "backend must not be null");
        MDC.put(MDC_SOURCE, String.valueOf(tree.sourceName()));
        try {
            return complete(tree, backend, System.nanoTime());
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }

    /**
     * Runs the full pipeline and hands the program to {@code sink}.
     *
     * @throws SinkException if the sink fails
     */
    public void transpile(String source, String sourceName, BackendAdapter backend, OutputSink sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        deliver(transpile(source, sourceName, backend), sourceName, backend, sink);
    }

    /**
     * Renders an already parsed tree and hands the program to {@code sink}.
     *
     * @throws SinkException if the sink fails
     */
    public void transpile(SyntaxTree tree, BackendAdapter backend, OutputSink sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        deliver(transpile(tree, backend), tree.sourceName(), backend, sink);
    }

    private String complete(SyntaxTree tree, BackendAdapter backend, long start) {
        String program = backend.wrap(render(tree, backend));
        LOG.info(
                "transpile.complete source={} backend={} nodes={} depth={} output_chars={} duration_ms={}",
                tree.sourceName(),
                backend.id(),
                tree.nodeCount(),
                tree.depth(),
                program.length(),
                (System.nanoTime() - start) / 1_000_000);
        return program;
    }

    private static void deliver(String program, String sourceName, BackendAdapter backend, OutputSink sink) {
        try {
            sink.write(program);
        } catch (IOException e) {
            throw new SinkException(
                    "Failed to write " + backend.displayName() + " output for " + sourceName + ": " + e.getMessage(),
                    e,
                    sourceName);
        }
    }
}
