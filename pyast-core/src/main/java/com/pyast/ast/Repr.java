package com.pyast.ast;

/**
 * Back-quote representation: {@code `value`}.
 */
public record Repr(
    int lineno,
    int colOffset,
    Expr value
) implements Expr {

    public Repr {
        NodeChecks.required(value, NodeKind.REPR, "value");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.REPR;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitRepr(this)) {
            return;
        }
        value.accept(visitor);
    }
}
