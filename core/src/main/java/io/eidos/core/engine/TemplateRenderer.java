package io.eidos.core.engine;

import io.eidos.core.error.TranspileException;
import io.eidos.core.error.UnknownRuleException;
import io.eidos.core.model.BlockNode;
import io.eidos.core.model.BlockRule;
import io.eidos.core.model.LanguageDefinition;
import io.eidos.core.model.Node;
import io.eidos.core.model.StatementNode;
import io.eidos.core.model.StatementRule;
import io.eidos.core.model.SyntaxTree;
import io.eidos.core.spi.RenderContext;
import io.eidos.core.spi.RenderHook;
import java.util.List;
import java.util.Objects;

/**
 * Renders a syntax tree into target text by template substitution.
 *
 * <p>
 * Statements: argument {@code i} replaces every {@code {i}} in the rule's template. Placeholders
 * with no argument are left as they are, surplus arguments are dropped. Blocks: the rendered
 * children, one level deeper, replace every {@code {body}} in the block template. Each rendered
 * node is indented at its depth and terminated by {@code \n}.
 *
 * <p>
 * Substitution is a single scan over the template; text coming from arguments or from a rendered
 * body is never scanned again, so a literal {@code {0}} or {@code {body}} in source survives
 * verbatim.
 *
 * <p>
 * Stateless; a fresh {@link RenderContext} is created per {@link #render} call.
 */
public final class TemplateRenderer {

    private final String indentUnit;

    public TemplateRenderer(String indentUnit) {
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit must not be null");
    }

    public TemplateRenderer() {
        this(TranspileOptions.DEFAULT_INDENT);
    }

    /** Renders {@code tree} starting at {@code depth} with no render hook. */
    public String render(SyntaxTree tree, int depth) {
        return render(tree, depth, RenderHook.NONE);
    }

    /**
     * Renders {@code tree} starting at {@code depth}.
     *
     * @throws UnknownRuleException if a node names a rule absent from the tree's definition
     */
    public String render(SyntaxTree tree, int depth, RenderHook hook) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(hook, "hook must not be null");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative, got: " + depth);
        }
        StringBuilder out = new StringBuilder();
        renderNodes(tree.nodes(), depth, new Scope(tree.definition(), tree.sourceName(), hook, new RenderContext()), out);
        return out.toString();
    }

    private void renderNodes(List<Node> nodes, int depth, Scope scope, StringBuilder out) {
        String indent = indentUnit.repeat(depth);
        for (Node node : nodes) {
            if (node instanceof StatementNode statement) {
                StatementRule rule = scope.definition
                        .statement(statement.ruleName())
                        .orElseThrow(() -> unknownRule(statement, UnknownRuleException.RuleKind.STATEMENT, scope));
                for (String extra : scope.hook.beforeStatement(statement, scope.context)) {
                    out.append(indent).append(extra).append('\n');
                }
                out.append(indent)
                        .append(substituteArguments(rule.template(), statement.arguments()))
                        .append('\n');
            } else if (node instanceof BlockNode block) {
                BlockRule rule = scope.definition
                        .block(block.ruleName())
                        .orElseThrow(() -> unknownRule(block, UnknownRuleException.RuleKind.BLOCK, scope));
                StringBuilder body = new StringBuilder();
                renderNodes(block.children(), depth + 1, scope, body);
                out.append(indent)
                        .append(rule.template().replace(BlockRule.BODY_PLACEHOLDER, body))
                        .append('\n');
            }
        }
    }

    /**
     * Replaces each {@code {i}} in {@code template} with {@code arguments.get(i)}. Only the canonical
     * decimal form counts as a placeholder ({@code {01}} is literal text).
     */
    public static String substituteArguments(String template, List<String> arguments) {
        if (arguments.isEmpty() || template.indexOf('{') < 0) {
            return template;
        }
        StringBuilder out = new StringBuilder(template.length());
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                int close = template.indexOf('}', i + 1);
                if (close > i + 1) {
                    int index = placeholderIndex(template.substring(i + 1, close));
                    if (index >= 0 && index < arguments.size()) {
                        out.append(arguments.get(index));
                        i = close + 1;
                        continue;
                    }
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static int placeholderIndex(String digits) {
        if (digits.length() > 9 || (digits.length() > 1 && digits.charAt(0) == '0')) {
            return -1;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (digits.charAt(i) < '0' || digits.charAt(i) > '9') {
                return -1;
            }
        }
        return Integer.parseInt(digits);
    }

    private static UnknownRuleException unknownRule(Node node, UnknownRuleException.RuleKind kind, Scope scope) {
        return new UnknownRuleException(
                "No " + kind.name().toLowerCase() + " rule named '" + node.ruleName() + "' in the language definition"
                        + (node.lineNumber() > 0 ? " (line " + node.lineNumber() + ")" : ""),
                TranspileException.Phase.RENDER,
                scope.sourceName,
                node.ruleName(),
                kind,
                node.lineNumber());
    }

    /** Everything that stays fixed for the duration of one render call. */
    private static final class Scope {
        private final LanguageDefinition definition;
        private final String sourceName;
        private final RenderHook hook;
        private final RenderContext context;

        private Scope(LanguageDefinition definition, String sourceName, RenderHook hook, RenderContext context) {
            this.definition = definition;
            this.sourceName = sourceName;
            this.hook = hook;
            this.context = context;
        }
    }
}
