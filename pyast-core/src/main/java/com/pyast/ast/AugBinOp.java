package com.pyast.ast;

import com.pyast.ops.OperatorCategory;
import com.pyast.ops.OperatorKind;

/**
 * The in-place operation an augmented assignment desugars to; executed through the operator's
 * in-place method before falling back to the plain one.
 */
public record AugBinOp(
    int lineno,
    int colOffset,
    Expr left,
    OperatorKind op,
    Expr right
) implements Expr {

    public AugBinOp {
        NodeChecks.required(left, NodeKind.AUG_BIN_OP, "left");
        NodeChecks.operator(op, NodeKind.AUG_BIN_OP, OperatorCategory.BINARY);
        NodeChecks.required(right, NodeKind.AUG_BIN_OP, "right");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AUG_BIN_OP;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitAugBinOp(this)) {
            return;
        }
        left.accept(visitor);
        right.accept(visitor);
    }
}
