package com.pyast.ast;

import java.util.List;

public record SetComp(
    int lineno,
    int colOffset,
    Expr elt,
    List<Comprehension> generators
) implements Expr {

    public SetComp {
        NodeChecks.required(elt, NodeKind.SET_COMP, "elt");
        generators = NodeChecks.nonEmptyList(generators, NodeKind.SET_COMP, "generators");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SET_COMP;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitSetComp(this)) {
            return;
        }
        Node.acceptAll(generators, visitor);
        elt.accept(visitor);
    }
}
