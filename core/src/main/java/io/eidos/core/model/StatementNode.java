package io.eidos.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Leaf of the syntax tree: one matched statement line.
 *
 * @param ruleName   statement rule name, or {@value LanguageDefinition#DEFAULT_STATEMENT} for
 *                   lines no rule matched
 * @param arguments  positional arguments in source order
 * @param lineNumber 1-based source line
 */
public record StatementNode(String ruleName, List<String> arguments, int lineNumber) implements Node {

    public StatementNode {
        Objects.requireNonNull(ruleName, "ruleName must not be null");
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    public StatementNode(String ruleName, List<String> arguments) {
        this(ruleName, arguments, 0);
    }
}
