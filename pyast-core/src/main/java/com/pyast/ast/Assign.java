package com.pyast.ast;

import java.util.List;

public record Assign(
    int lineno,
    int colOffset,
    List<Expr> targets,
    Expr value
) implements Stmt {

    public Assign {
        targets = NodeChecks.nonEmptyList(targets, NodeKind.ASSIGN, "targets");
        NodeChecks.required(value, NodeKind.ASSIGN, "value");
    }

    public Assign(List<Expr> targets, Expr value) {
        this(0, 0, targets, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitAssign(this)) {
            return;
        }
        value.accept(visitor);
        // Targets are assigned left to right, so "x = x.a = v" is valid but "x.a = x = v" is not.
        Node.acceptAll(targets, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitAssign(this);
    }
}
