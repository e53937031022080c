package com.pyast.ast;

public record Ellipsis(
    int lineno,
    int colOffset
) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.ELLIPSIS;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitEllipsis(this);
    }
}
