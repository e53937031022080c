package com.pyast.ast;

import java.util.List;

public record DictComp(
    int lineno,
    int colOffset,
    Expr key,
    Expr value,
    List<Comprehension> generators
) implements Expr {

    public DictComp {
        NodeChecks.required(key, NodeKind.DICT_COMP, "key");
        NodeChecks.required(value, NodeKind.DICT_COMP, "value");
        generators = NodeChecks.nonEmptyList(generators, NodeKind.DICT_COMP, "generators");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DICT_COMP;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitDictComp(this)) {
            return;
        }
        Node.acceptAll(generators, visitor);
        // value before key
        value.accept(visitor);
        key.accept(visitor);
    }
}
