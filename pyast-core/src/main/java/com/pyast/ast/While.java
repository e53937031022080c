package com.pyast.ast;

import java.util.List;

public record While(
    int lineno,
    int colOffset,
    Expr test,
    List<Stmt> body,
    List<Stmt> orelse
) implements Stmt {

    public While {
        NodeChecks.required(test, NodeKind.WHILE, "test");
        body = NodeChecks.nonEmptyList(body, NodeKind.WHILE, "body");
        orelse = NodeChecks.requiredList(orelse, NodeKind.WHILE, "orelse");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WHILE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitWhile(this)) {
            return;
        }
        test.accept(visitor);
        Node.acceptAll(body, visitor);
        Node.acceptAll(orelse, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitWhile(this);
    }
}
