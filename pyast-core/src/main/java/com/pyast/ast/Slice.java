package com.pyast.ast;

public record Slice(
    int lineno,
    int colOffset,
    Expr lower,  // Can be null
    Expr upper,  // Can be null
    Expr step    // Can be null
) implements SliceExpr {

    @Override
    public NodeKind kind() {
        return NodeKind.SLICE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitSlice(this)) {
            return;
        }
        if (lower != null) {
            lower.accept(visitor);
        }
        if (upper != null) {
            upper.accept(visitor);
        }
        if (step != null) {
            step.accept(visitor);
        }
    }
}
