package com.pyast.ast;

public record Attribute(
    int lineno,
    int colOffset,
    Expr value,
    InternedString attr,
    ExprContext ctx
) implements Expr {

    public Attribute {
        NodeChecks.required(value, NodeKind.ATTRIBUTE, "value");
        NodeChecks.required(attr, NodeKind.ATTRIBUTE, "attr");
        NodeChecks.required(ctx, NodeKind.ATTRIBUTE, "ctx");
    }

    public Attribute(Expr value, InternedString attr, ExprContext ctx) {
        this(0, 0, value, attr, ctx);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitAttribute(this)) {
            return;
        }
        value.accept(visitor);
    }
}
