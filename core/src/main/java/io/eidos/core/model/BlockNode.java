package io.eidos.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Interior node of the syntax tree: a closed block and the nodes nested in it.
 *
 * @param ruleName   block rule that opened the block
 * @param children   nested nodes in source order
 * @param lineNumber 1-based line of the opening line
 */
public record BlockNode(String ruleName, List<Node> children, int lineNumber) implements Node {

    public BlockNode {
        Objects.requireNonNull(ruleName, "ruleName must not be null");
        children = children != null ? List.copyOf(children) : List.of();
    }

    public BlockNode(String ruleName, List<Node> children) {
        this(ruleName, children, 0);
    }
}
