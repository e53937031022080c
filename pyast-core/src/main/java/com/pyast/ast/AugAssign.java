package com.pyast.ast;

import com.pyast.ops.OperatorCategory;
import com.pyast.ops.OperatorKind;

public record AugAssign(
    int lineno,
    int colOffset,
    Expr target,
    OperatorKind op,
    Expr value
) implements Stmt {

    public AugAssign {
        NodeChecks.required(target, NodeKind.AUG_ASSIGN, "target");
        NodeChecks.operator(op, NodeKind.AUG_ASSIGN, OperatorCategory.BINARY);
        NodeChecks.required(value, NodeKind.AUG_ASSIGN, "value");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AUG_ASSIGN;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitAugAssign(this)) {
            return;
        }
        value.accept(visitor);
        target.accept(visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitAugAssign(this);
    }
}
