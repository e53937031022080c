package com.pyast.ast;

import com.pyast.ops.OperatorCategory;
import com.pyast.ops.OperatorKind;

import java.util.List;

public record BoolOp(
    int lineno,
    int colOffset,
    OperatorKind op,
    List<Expr> values
) implements Expr {

    public BoolOp {
        NodeChecks.operator(op, NodeKind.BOOL_OP, OperatorCategory.BOOLEAN);
        values = NodeChecks.nonEmptyList(values, NodeKind.BOOL_OP, "values");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BOOL_OP;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitBoolOp(this)) {
            return;
        }
        Node.acceptAll(values, visitor);
    }
}
