package com.pyast.ast;

import java.util.List;

public record ExtSlice(
    int lineno,
    int colOffset,
    List<SliceExpr> dims
) implements SliceExpr {

    public ExtSlice {
        dims = NodeChecks.nonEmptyList(dims, NodeKind.EXT_SLICE, "dims");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXT_SLICE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitExtSlice(this)) {
            return;
        }
        Node.acceptAll(dims, visitor);
    }
}
