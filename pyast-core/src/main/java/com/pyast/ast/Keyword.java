package com.pyast.ast;

public record Keyword(
    int lineno,
    int colOffset,
    InternedString arg,
    Expr value
) implements Node {

    public Keyword {
        NodeChecks.required(arg, NodeKind.KEYWORD, "arg");
        NodeChecks.required(value, NodeKind.KEYWORD, "value");
    }

    public Keyword(InternedString arg, Expr value) {
        this(0, 0, arg, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.KEYWORD;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitKeyword(this)) {
            return;
        }
        value.accept(visitor);
    }
}
