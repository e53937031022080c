package com.pyast.ast;

import java.util.List;

/**
 * A top-level module. Owns the identifier pool of its tree.
 */
public record Program(
    int lineno,
    int colOffset,
    List<Stmt> body,
    InternedStringPool stringPool
) implements Node {

    public Program {
        body = NodeChecks.requiredList(body, NodeKind.PROGRAM, "body");
        NodeChecks.required(stringPool, NodeKind.PROGRAM, "stringPool");
    }

    public Program(List<Stmt> body, InternedStringPool stringPool) {
        this(0, 0, body, stringPool);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROGRAM;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitProgram(this)) {
            return;
        }
        Node.acceptAll(body, visitor);
    }
}
