package com.pyast.ast;

public record Pass(
    int lineno,
    int colOffset
) implements Stmt {

    @Override
    public NodeKind kind() {
        return NodeKind.PASS;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitPass(this);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitPass(this);
    }
}
