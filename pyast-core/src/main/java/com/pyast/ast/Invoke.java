package com.pyast.ast;

/**
 * Wraps a statement that may raise. Control continues at {@code normalDest} when it completes
 * and at {@code excDest} when it raises.
 *
 * <p>The two destinations point into the control-flow graph; they are not children and are never
 * visited.</p>
 */
public record Invoke(
    int lineno,
    int colOffset,
    Stmt stmt,
    BlockRef normalDest,
    BlockRef excDest
) implements Stmt {

    public Invoke {
        NodeChecks.required(stmt, NodeKind.INVOKE, "stmt");
        NodeChecks.required(normalDest, NodeKind.INVOKE, "normalDest");
        NodeChecks.required(excDest, NodeKind.INVOKE, "excDest");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INVOKE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitInvoke(this)) {
            return;
        }
        stmt.accept(visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitInvoke(this);
    }
}
