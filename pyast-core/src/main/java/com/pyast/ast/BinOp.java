package com.pyast.ast;

import com.pyast.ops.OperatorCategory;
import com.pyast.ops.OperatorKind;

public record BinOp(
    int lineno,
    int colOffset,
    Expr left,
    OperatorKind op,
    Expr right
) implements Expr {

    public BinOp {
        NodeChecks.required(left, NodeKind.BIN_OP, "left");
        NodeChecks.operator(op, NodeKind.BIN_OP, OperatorCategory.BINARY);
        NodeChecks.required(right, NodeKind.BIN_OP, "right");
    }

    public BinOp(Expr left, OperatorKind op, Expr right) {
        this(0, 0, left, op, right);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BIN_OP;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitBinOp(this)) {
            return;
        }
        left.accept(visitor);
        right.accept(visitor);
    }
}
