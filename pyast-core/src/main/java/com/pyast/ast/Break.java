package com.pyast.ast;

public record Break(
    int lineno,
    int colOffset
) implements Stmt {

    @Override
    public NodeKind kind() {
        return NodeKind.BREAK;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitBreak(this);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitBreak(this);
    }
}
