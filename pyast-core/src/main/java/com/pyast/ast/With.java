package com.pyast.ast;

import java.util.List;

public record With(
    int lineno,
    int colOffset,
    Expr contextExpr,
    Expr optionalVars,  // Can be null
    List<Stmt> body
) implements Stmt {

    public With {
        NodeChecks.required(contextExpr, NodeKind.WITH, "contextExpr");
        body = NodeChecks.nonEmptyList(body, NodeKind.WITH, "body");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WITH;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitWith(this)) {
            return;
        }
        contextExpr.accept(visitor);
        if (optionalVars != null) {
            optionalVars.accept(visitor);
        }
        Node.acceptAll(body, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitWith(this);
    }
}
