package com.pyast.ast;

/**
 * {@code body if test else orelse}; visited in evaluation order, test first.
 */
public record IfExp(
    int lineno,
    int colOffset,
    Expr test,
    Expr body,
    Expr orelse
) implements Expr {

    public IfExp {
        NodeChecks.required(test, NodeKind.IF_EXP, "test");
        NodeChecks.required(body, NodeKind.IF_EXP, "body");
        NodeChecks.required(orelse, NodeKind.IF_EXP, "orelse");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF_EXP;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitIfExp(this)) {
            return;
        }
        test.accept(visitor);
        body.accept(visitor);
        orelse.accept(visitor);
    }
}
