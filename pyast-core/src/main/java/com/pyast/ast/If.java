package com.pyast.ast;

import java.util.List;

public record If(
    int lineno,
    int colOffset,
    Expr test,
    List<Stmt> body,
    List<Stmt> orelse
) implements Stmt {

    public If {
        NodeChecks.required(test, NodeKind.IF, "test");
        body = NodeChecks.nonEmptyList(body, NodeKind.IF, "body");
        orelse = NodeChecks.requiredList(orelse, NodeKind.IF, "orelse");
    }

    public If(Expr test, List<Stmt> body, List<Stmt> orelse) {
        this(0, 0, test, body, orelse);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitIf(this)) {
            return;
        }
        test.accept(visitor);
        Node.acceptAll(body, visitor);
        Node.acceptAll(orelse, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitIf(this);
    }
}
