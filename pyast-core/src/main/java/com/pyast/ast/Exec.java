package com.pyast.ast;

public record Exec(
    int lineno,
    int colOffset,
    Expr body,
    Expr globals,  // Can be null
    Expr locals    // Can be null
) implements Stmt {

    public Exec {
        NodeChecks.required(body, NodeKind.EXEC, "body");
        NodeChecks.requireOrdered(globals, locals, NodeKind.EXEC, "globals", "locals");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXEC;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitExec(this)) {
            return;
        }
        body.accept(visitor);
        if (globals != null) {
            globals.accept(visitor);
        }
        if (locals != null) {
            locals.accept(visitor);
        }
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitExec(this);
    }
}
