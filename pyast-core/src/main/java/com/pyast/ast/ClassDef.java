package com.pyast.ast;

import java.util.List;

public record ClassDef(
    int lineno,
    int colOffset,
    InternedString name,
    List<Expr> bases,
    List<Expr> decoratorList,
    List<Stmt> body
) implements Stmt {

    public ClassDef {
        NodeChecks.required(name, NodeKind.CLASS_DEF, "name");
        bases = NodeChecks.requiredList(bases, NodeKind.CLASS_DEF, "bases");
        decoratorList = NodeChecks.requiredList(decoratorList, NodeKind.CLASS_DEF, "decoratorList");
        body = NodeChecks.nonEmptyList(body, NodeKind.CLASS_DEF, "body");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CLASS_DEF;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitClassDef(this)) {
            return;
        }
        Node.acceptAll(bases, visitor);
        Node.acceptAll(decoratorList, visitor);
        Node.acceptAll(body, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitClassDef(this);
    }
}
