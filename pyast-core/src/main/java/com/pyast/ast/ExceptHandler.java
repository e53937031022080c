package com.pyast.ast;

import java.util.List;

public record ExceptHandler(
    int lineno,
    int colOffset,
    Expr type,  // Can be null
    Expr name,  // Can be null
    List<Stmt> body
) implements Node {

    public ExceptHandler {
        NodeChecks.requireOrdered(type, name, NodeKind.EXCEPT_HANDLER, "type", "name");
        body = NodeChecks.nonEmptyList(body, NodeKind.EXCEPT_HANDLER, "body");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXCEPT_HANDLER;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitExceptHandler(this)) {
            return;
        }
        if (type != null) {
            type.accept(visitor);
        }
        if (name != null) {
            name.accept(visitor);
        }
        Node.acceptAll(body, visitor);
    }
}
