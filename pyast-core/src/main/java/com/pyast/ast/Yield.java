package com.pyast.ast;

public record Yield(
    int lineno,
    int colOffset,
    Expr value  // Can be null
) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.YIELD;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitYield(this)) {
            return;
        }
        if (value != null) {
            value.accept(visitor);
        }
    }
}
