package com.pyast.ast;

import com.pyast.ops.OperatorCategory;
import com.pyast.ops.OperatorKind;

public record UnaryOp(
    int lineno,
    int colOffset,
    OperatorKind op,
    Expr operand
) implements Expr {

    public UnaryOp {
        NodeChecks.operator(op, NodeKind.UNARY_OP, OperatorCategory.UNARY);
        NodeChecks.required(operand, NodeKind.UNARY_OP, "operand");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitUnaryOp(this)) {
            return;
        }
        operand.accept(visitor);
    }
}
