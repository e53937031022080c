package com.pyast.ast;

import java.util.List;

public record For(
    int lineno,
    int colOffset,
    Expr target,
    Expr iter,
    List<Stmt> body,
    List<Stmt> orelse
) implements Stmt {

    public For {
        NodeChecks.required(target, NodeKind.FOR, "target");
        NodeChecks.required(iter, NodeKind.FOR, "iter");
        body = NodeChecks.nonEmptyList(body, NodeKind.FOR, "body");
        orelse = NodeChecks.requiredList(orelse, NodeKind.FOR, "orelse");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitFor(this)) {
            return;
        }
        // the iterable is evaluated once, before the target is first bound
        iter.accept(visitor);
        target.accept(visitor);
        Node.acceptAll(body, visitor);
        Node.acceptAll(orelse, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitFor(this);
    }
}
