package com.pyast.ast;

import java.util.List;

public record ListComp(
    int lineno,
    int colOffset,
    Expr elt,
    List<Comprehension> generators
) implements Expr {

    public ListComp {
        NodeChecks.required(elt, NodeKind.LIST_COMP, "elt");
        generators = NodeChecks.nonEmptyList(generators, NodeKind.LIST_COMP, "generators");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST_COMP;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitListComp(this)) {
            return;
        }
        // the element is evaluated once per iteration, after the clauses that bind it
        Node.acceptAll(generators, visitor);
        elt.accept(visitor);
    }
}
