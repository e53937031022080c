package com.pyast.ast;

public record Assert(
    int lineno,
    int colOffset,
    Expr test,
    Expr msg  // Can be null
) implements Stmt {

    public Assert {
        NodeChecks.required(test, NodeKind.ASSERT, "test");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSERT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitAssert(this)) {
            return;
        }
        test.accept(visitor);
        if (msg != null) {
            msg.accept(visitor);
        }
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitAssert(this);
    }
}
