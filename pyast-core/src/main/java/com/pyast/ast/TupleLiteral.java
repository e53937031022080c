package com.pyast.ast;

import java.util.List;

public record TupleLiteral(
    int lineno,
    int colOffset,
    List<Expr> elts,
    ExprContext ctx
) implements Expr {

    public TupleLiteral {
        elts = NodeChecks.requiredList(elts, NodeKind.TUPLE, "elts");
        NodeChecks.required(ctx, NodeKind.TUPLE, "ctx");
    }

    public TupleLiteral(List<Expr> elts, ExprContext ctx) {
        this(0, 0, elts, ctx);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TUPLE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitTupleLiteral(this)) {
            return;
        }
        Node.acceptAll(elts, visitor);
    }
}
