package io.eidos.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing one source document. Bound to the definition it was parsed with, so rendering
 * resolves rules against the same rule set the classifier matched against.
 *
 * @param definition the language definition used to parse
 * @param nodes      top-level nodes in source order
 * @param sourceName name of the parsed document, used in diagnostics
 */
public record SyntaxTree(LanguageDefinition definition, List<Node> nodes, String sourceName) {

    public SyntaxTree {
        Objects.requireNonNull(definition, "definition must not be null");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
    }

    /** Number of block levels along the deepest path; {@code 0} for a flat tree. */
    public int depth() {
        return depth(nodes);
    }

    /** Total number of nodes, nested ones included. */
    public int nodeCount() {
        return count(nodes);
    }

    private static int depth(List<Node> nodes) {
        int max = 0;
        for (Node node : nodes) {
            if (node instanceof BlockNode block) {
                max = Math.max(max, 1 + depth(block.children()));
            }
        }
        return max;
    }

    private static int count(List<Node> nodes) {
        int total = 0;
        for (Node node : nodes) {
            total++;
            if (node instanceof BlockNode block) {
                total += count(block.children());
            }
        }
        return total;
    }
}
