package com.pyast.ast;

import java.util.List;

/**
 * One {@code for target in iter [if cond]...} clause of a comprehension or generator expression.
 */
public record Comprehension(
    int lineno,
    int colOffset,
    Expr target,
    Expr iter,
    List<Expr> ifs
) implements Node {

    public Comprehension {
        NodeChecks.required(target, NodeKind.COMPREHENSION, "target");
        NodeChecks.required(iter, NodeKind.COMPREHENSION, "iter");
        ifs = NodeChecks.requiredList(ifs, NodeKind.COMPREHENSION, "ifs");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPREHENSION;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitComprehension(this)) {
            return;
        }
        target.accept(visitor);
        iter.accept(visitor);
        Node.acceptAll(ifs, visitor);
    }
}
