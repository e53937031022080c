package com.pyast.ast;

import java.util.List;

/**
 * Base interface for all syntax tree nodes.
 *
 * <p>Nodes are records: their shape is fixed at construction, required children are checked
 * there, and list children are unmodifiable copies. A pass that needs a different shape builds a
 * new node and replaces the subtree at the parent.</p>
 */
public sealed interface Node permits
    Expr,
    Stmt,
    Alias,
    Arguments,
    Keyword,
    Comprehension,
    ExceptHandler,
    Program,
    Expression,
    Suite {

    NodeKind kind();

    int lineno();

    int colOffset();

    /**
     * Calls the handler of {@code visitor} that matches this node's kind and, if it returns
     * {@code true}, visits the children in evaluation order.
     */
    void accept(AstVisitor visitor);

    static void acceptAll(List<? extends Node> nodes, AstVisitor visitor) {
        for (Node node : nodes) {
            node.accept(visitor);
        }
    }
}
