package com.pyast.ast;

public record Lambda(
    int lineno,
    int colOffset,
    Arguments args,
    Expr body
) implements Expr {

    public Lambda {
        NodeChecks.required(args, NodeKind.LAMBDA, "args");
        NodeChecks.required(body, NodeKind.LAMBDA, "body");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAMBDA;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitLambda(this)) {
            return;
        }
        args.accept(visitor);
        body.accept(visitor);
    }
}
