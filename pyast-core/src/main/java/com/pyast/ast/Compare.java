package com.pyast.ast;

import com.pyast.InternalConsistencyError;
import com.pyast.ops.OperatorKind;

import java.util.List;

/**
 * A comparison chain: {@code left ops[0] comparators[0] ops[1] comparators[1] ...}.
 */
public record Compare(
    int lineno,
    int colOffset,
    Expr left,
    List<OperatorKind> ops,
    List<Expr> comparators
) implements Expr {

    public Compare {
        NodeChecks.required(left, NodeKind.COMPARE, "left");
        ops = NodeChecks.nonEmptyList(ops, NodeKind.COMPARE, "ops");
        comparators = NodeChecks.requiredList(comparators, NodeKind.COMPARE, "comparators");
        NodeChecks.sameSize(ops, comparators, NodeKind.COMPARE, "ops", "comparators");
        for (OperatorKind op : ops) {
            if (!op.isComparator()) {
                throw new InternalConsistencyError("COMPARE cannot carry " + op.category() + " operator " + op);
            }
        }
    }

    public Compare(Expr left, List<OperatorKind> ops, List<Expr> comparators) {
        this(0, 0, left, ops, comparators);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPARE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitCompare(this)) {
            return;
        }
        left.accept(visitor);
        Node.acceptAll(comparators, visitor);
    }
}
