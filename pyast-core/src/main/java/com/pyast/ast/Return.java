package com.pyast.ast;

public record Return(
    int lineno,
    int colOffset,
    Expr value  // Can be null
) implements Stmt {

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitReturn(this)) {
            return;
        }
        if (value != null) {
            value.accept(visitor);
        }
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitReturn(this);
    }
}
