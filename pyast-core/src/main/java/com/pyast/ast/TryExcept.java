package com.pyast.ast;

import java.util.List;

public record TryExcept(
    int lineno,
    int colOffset,
    List<Stmt> body,
    List<ExceptHandler> handlers,
    List<Stmt> orelse
) implements Stmt {

    public TryExcept {
        body = NodeChecks.nonEmptyList(body, NodeKind.TRY_EXCEPT, "body");
        handlers = NodeChecks.nonEmptyList(handlers, NodeKind.TRY_EXCEPT, "handlers");
        orelse = NodeChecks.requiredList(orelse, NodeKind.TRY_EXCEPT, "orelse");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRY_EXCEPT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitTryExcept(this)) {
            return;
        }
        // the else clause runs on normal completion of the body, so it comes before the handlers
        Node.acceptAll(body, visitor);
        Node.acceptAll(orelse, visitor);
        Node.acceptAll(handlers, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitTryExcept(this);
    }
}
