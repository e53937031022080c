package com.pyast.ast;

public record Index(
    int lineno,
    int colOffset,
    Expr value
) implements SliceExpr {

    public Index {
        NodeChecks.required(value, NodeKind.INDEX, "value");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INDEX;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitIndex(this)) {
            return;
        }
        value.accept(visitor);
    }
}
