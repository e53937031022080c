package com.pyast.ast;

import java.util.List;

public record Suite(
    int lineno,
    int colOffset,
    List<Stmt> body
) implements Node {

    public Suite {
        body = NodeChecks.requiredList(body, NodeKind.SUITE, "body");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUITE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitSuite(this)) {
            return;
        }
        Node.acceptAll(body, visitor);
    }
}
