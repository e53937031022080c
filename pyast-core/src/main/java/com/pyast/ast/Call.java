package com.pyast.ast;

import java.util.List;

public record Call(
    int lineno,
    int colOffset,
    Expr func,
    List<Expr> args,
    List<Keyword> keywords,
    Expr starargs,  // Can be null
    Expr kwargs     // Can be null
) implements Expr {

    public Call {
        NodeChecks.required(func, NodeKind.CALL, "func");
        args = NodeChecks.requiredList(args, NodeKind.CALL, "args");
        keywords = NodeChecks.requiredList(keywords, NodeKind.CALL, "keywords");
    }

    public Call(Expr func, List<Expr> args) {
        this(0, 0, func, args, List.of(), null, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitCall(this)) {
            return;
        }
        func.accept(visitor);
        Node.acceptAll(args, visitor);
        Node.acceptAll(keywords, visitor);
        if (starargs != null) {
            starargs.accept(visitor);
        }
        if (kwargs != null) {
            kwargs.accept(visitor);
        }
    }
}
