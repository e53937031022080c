package com.pyast.ast;

import java.util.List;

public record SetLiteral(
    int lineno,
    int colOffset,
    List<Expr> elts
) implements Expr {

    public SetLiteral {
        elts = NodeChecks.requiredList(elts, NodeKind.SET, "elts");
    }

    public SetLiteral(List<Expr> elts) {
        this(0, 0, elts);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SET;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitSetLiteral(this)) {
            return;
        }
        Node.acceptAll(elts, visitor);
    }
}
