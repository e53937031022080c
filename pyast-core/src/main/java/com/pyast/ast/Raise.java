package com.pyast.ast;

/**
 * {@code raise [arg0 [, arg1 [, arg2]]]}: type, value and traceback in the legacy three-argument
 * form.
 */
public record Raise(
    int lineno,
    int colOffset,
    Expr arg0,  // Can be null
    Expr arg1,  // Can be null
    Expr arg2   // Can be null
) implements Stmt {

    public Raise {
        NodeChecks.requireOrdered(arg0, arg1, NodeKind.RAISE, "arg0", "arg1");
        NodeChecks.requireOrdered(arg1, arg2, NodeKind.RAISE, "arg1", "arg2");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RAISE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitRaise(this)) {
            return;
        }
        if (arg0 != null) {
            arg0.accept(visitor);
        }
        if (arg1 != null) {
            arg1.accept(visitor);
        }
        if (arg2 != null) {
            arg2.accept(visitor);
        }
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitRaise(this);
    }
}
