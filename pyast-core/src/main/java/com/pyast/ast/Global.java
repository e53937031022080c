package com.pyast.ast;

import java.util.List;

public record Global(
    int lineno,
    int colOffset,
    List<InternedString> names
) implements Stmt {

    public Global {
        names = NodeChecks.nonEmptyList(names, NodeKind.GLOBAL, "names");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GLOBAL;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitGlobal(this);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitGlobal(this);
    }
}
