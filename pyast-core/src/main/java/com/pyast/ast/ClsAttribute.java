package com.pyast.ast;

/**
 * Attribute lookup performed on the class of {@code value} rather than on the instance. Produced
 * by desugaring, never by the parser.
 */
public record ClsAttribute(
    int lineno,
    int colOffset,
    Expr value,
    InternedString attr
) implements Expr {

    public ClsAttribute {
        NodeChecks.required(value, NodeKind.CLS_ATTRIBUTE, "value");
        NodeChecks.required(attr, NodeKind.CLS_ATTRIBUTE, "attr");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CLS_ATTRIBUTE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitClsAttribute(this)) {
            return;
        }
        value.accept(visitor);
    }
}
