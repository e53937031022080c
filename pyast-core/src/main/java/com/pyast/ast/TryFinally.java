package com.pyast.ast;

import java.util.List;

public record TryFinally(
    int lineno,
    int colOffset,
    List<Stmt> body,
    List<Stmt> finalbody
) implements Stmt {

    public TryFinally {
        body = NodeChecks.nonEmptyList(body, NodeKind.TRY_FINALLY, "body");
        finalbody = NodeChecks.nonEmptyList(finalbody, NodeKind.TRY_FINALLY, "finalbody");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRY_FINALLY;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitTryFinally(this)) {
            return;
        }
        Node.acceptAll(body, visitor);
        Node.acceptAll(finalbody, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitTryFinally(this);
    }
}
