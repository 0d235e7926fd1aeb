package io.eidos.core.model;

/** A node of the syntax tree produced by the tree builder. */
public sealed interface Node permits StatementNode, BlockNode {

    /** Name of the statement or block rule this node was matched by. */
    String ruleName();

    /** 1-based line of the source that produced this node (the opening line for blocks). */
    int lineNumber();
}
