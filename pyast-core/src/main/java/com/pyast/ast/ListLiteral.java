package com.pyast.ast;

import java.util.List;

public record ListLiteral(
    int lineno,
    int colOffset,
    List<Expr> elts,
    ExprContext ctx
) implements Expr {

    public ListLiteral {
        elts = NodeChecks.requiredList(elts, NodeKind.LIST, "elts");
        NodeChecks.required(ctx, NodeKind.LIST, "ctx");
    }

    public ListLiteral(List<Expr> elts, ExprContext ctx) {
        this(0, 0, elts, ctx);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitListLiteral(this)) {
            return;
        }
        Node.acceptAll(elts, visitor);
    }
}
