package com.pyast.ast;

public record Name(
    int lineno,
    int colOffset,
    InternedString id,
    ExprContext ctx
) implements Expr {

    public Name {
        NodeChecks.required(id, NodeKind.NAME, "id");
        NodeChecks.required(ctx, NodeKind.NAME, "ctx");
    }

    public Name(InternedString id, ExprContext ctx) {
        this(0, 0, id, ctx);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NAME;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitName(this);
    }
}
