package com.pyast.ast;

/**
 * {@code name [as asname]} inside an import statement.
 */
public record Alias(
    int lineno,
    int colOffset,
    InternedString name,
    InternedString asname  // Can be null
) implements Node {

    public Alias {
        NodeChecks.required(name, NodeKind.ALIAS, "name");
    }

    public Alias(InternedString name, InternedString asname) {
        this(0, 0, name, asname);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ALIAS;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitAlias(this);
    }
}
