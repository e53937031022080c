package com.pyast.ast;

public record Continue(
    int lineno,
    int colOffset
) implements Stmt {

    @Override
    public NodeKind kind() {
        return NodeKind.CONTINUE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitContinue(this);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitContinue(this);
    }
}
