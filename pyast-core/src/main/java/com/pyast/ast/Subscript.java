package com.pyast.ast;

public record Subscript(
    int lineno,
    int colOffset,
    Expr value,
    SliceExpr slice,
    ExprContext ctx
) implements Expr {

    public Subscript {
        NodeChecks.required(value, NodeKind.SUBSCRIPT, "value");
        NodeChecks.required(slice, NodeKind.SUBSCRIPT, "slice");
        NodeChecks.required(ctx, NodeKind.SUBSCRIPT, "ctx");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUBSCRIPT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitSubscript(this)) {
            return;
        }
        value.accept(visitor);
        slice.accept(visitor);
    }
}
