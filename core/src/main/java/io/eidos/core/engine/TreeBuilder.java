package io.eidos.core.engine;

import io.eidos.core.error.MalformedSourceException;
import io.eidos.core.error.TranspileException;
import io.eidos.core.error.UnknownRuleException;
import io.eidos.core.model.BlockNode;
import io.eidos.core.model.LanguageDefinition;
import io.eidos.core.model.Node;
import io.eidos.core.model.StatementNode;
import io.eidos.core.model.SyntaxTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the syntax tree of one source document in a single top-to-bottom pass. Lines are split on
 * any line terminator, stripped, and blank ones skipped; line numbers in nodes and errors refer to
 * the original, unfiltered source.
 *
 * <p>
 * Stateless between calls: every {@link #build} owns its own parse stack.
 */
public final class TreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TreeBuilder.class);

    private final LanguageDefinition definition;
    private final LineClassifier classifier;

    public TreeBuilder(LanguageDefinition definition, ClosePolicy closePolicy) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.classifier = new LineClassifier(definition, closePolicy);
    }

    public TreeBuilder(LanguageDefinition definition) {
        this(definition, ClosePolicy.ANY_END);
    }

    /**
     * Parses {@code source} into a syntax tree.
     *
     * @param source     raw source text
     * @param sourceName document name for diagnostics, may be null
     * @return the tree, bound to this builder's definition
     * @throws MalformedSourceException if a block is still open at end of input
     * @throws UnknownRuleException     if a line needs the default rule and the definition has none
     */
    public SyntaxTree build(String source, String sourceName) {
        Objects.requireNonNull(source, "source must not be null");

        List<Node> topLevel = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        int lineNumber = 0;
        Iterator<String> lines = source.lines().iterator();
        while (lines.hasNext()) {
            lineNumber++;
            String line = lines.next().strip();
            if (line.isEmpty()) {
                continue;
            }

            Frame top = stack.peek();
            MatchOutcome outcome = classifier.classify(line, top != null ? top.ruleName : null);

            if (outcome instanceof MatchOutcome.OpenBlock open) {
                stack.push(new Frame(open.ruleName(), lineNumber));
            } else if (outcome instanceof MatchOutcome.CloseBlock) {
                Frame closed = stack.poll();
                if (closed == null) {
                    throw new IllegalStateException(
                            "Close-block outcome with no open block at line " + lineNumber + " of " + sourceName);
                }
                append(stack, topLevel, new BlockNode(closed.ruleName, closed.children, closed.lineNumber));
            } else if (outcome instanceof MatchOutcome.Statement statement) {
                append(stack, topLevel, new StatementNode(statement.ruleName(), statement.arguments(), lineNumber));
            } else if (outcome instanceof MatchOutcome.DefaultStatement fallback) {
                requireDefaultRule(sourceName, lineNumber);
                LOG.debug("No rule matched line {} of {}: {}", lineNumber, sourceName, fallback.line());
                append(
                        stack,
                        topLevel,
                        new StatementNode(LanguageDefinition.DEFAULT_STATEMENT, List.of(fallback.line()), lineNumber));
            }
        }

        if (!stack.isEmpty()) {
            Frame unclosed = stack.peek();
            String end = definition.blocks().get(unclosed.ruleName).end();
            throw new MalformedSourceException(
                    "Unclosed block '" + unclosed.ruleName + "' opened at line " + unclosed.lineNumber
                            + " — expected a line starting with '" + end + "' before end of input"
                            + (stack.size() > 1 ? " (" + stack.size() + " blocks open)" : ""),
                    sourceName,
                    unclosed.lineNumber,
                    unclosed.ruleName);
        }

        return new SyntaxTree(definition, topLevel, sourceName);
    }

    private void requireDefaultRule(String sourceName, int lineNumber) {
        if (!definition.hasDefaultStatement()) {
            throw new UnknownRuleException(
                    "Line " + lineNumber + " matches no rule and the definition has no '"
                            + LanguageDefinition.DEFAULT_STATEMENT + "' statement to fall back to",
                    TranspileException.Phase.PARSE,
                    sourceName,
                    LanguageDefinition.DEFAULT_STATEMENT,
                    UnknownRuleException.RuleKind.STATEMENT,
                    lineNumber);
        }
    }

    private static void append(Deque<Frame> stack, List<Node> topLevel, Node node) {
        Frame top = stack.peek();
        if (top != null) {
            top.children.add(node);
        } else {
            topLevel.add(node);
        }
    }

    /** One open, not yet closed block. */
    private static final class Frame {
        private final String ruleName;
        private final int lineNumber;
        private final List<Node> children = new ArrayList<>();

        private Frame(String ruleName, int lineNumber) {
            this.ruleName = ruleName;
            this.lineNumber = lineNumber;
        }
    }
}
