package com.pyast.ast;

/**
 * An expression evaluated for its side effects.
 */
public record ExprStmt(
    int lineno,
    int colOffset,
    Expr value
) implements Stmt {

    public ExprStmt {
        NodeChecks.required(value, NodeKind.EXPR, "value");
    }

    public ExprStmt(Expr value) {
        this(0, 0, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPR;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitExprStmt(this)) {
            return;
        }
        value.accept(visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitExprStmt(this);
    }
}
