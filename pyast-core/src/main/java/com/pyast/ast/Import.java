package com.pyast.ast;

import java.util.List;

public record Import(
    int lineno,
    int colOffset,
    List<Alias> names
) implements Stmt {

    public Import {
        names = NodeChecks.nonEmptyList(names, NodeKind.IMPORT, "names");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitImport(this)) {
            return;
        }
        Node.acceptAll(names, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitImport(this);
    }
}
