package com.pyast.ast;

/**
 * Root of a standalone expression, as compiled for {@code eval}. Owns the identifier pool of its
 * tree.
 */
public record Expression(
    int lineno,
    int colOffset,
    Expr body,
    InternedStringPool stringPool
) implements Node {

    public Expression {
        NodeChecks.required(body, NodeKind.EXPRESSION, "body");
        NodeChecks.required(stringPool, NodeKind.EXPRESSION, "stringPool");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPRESSION;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitExpression(this)) {
            return;
        }
        body.accept(visitor);
    }
}
