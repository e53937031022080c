package com.pyast.ast;

import java.util.List;

public record Delete(
    int lineno,
    int colOffset,
    List<Expr> targets
) implements Stmt {

    public Delete {
        targets = NodeChecks.nonEmptyList(targets, NodeKind.DELETE, "targets");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DELETE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitDelete(this)) {
            return;
        }
        Node.acceptAll(targets, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitDelete(this);
    }
}
