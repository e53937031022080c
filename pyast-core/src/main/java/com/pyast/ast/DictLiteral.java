package com.pyast.ast;

import java.util.List;

/**
 * A dict display. {@code keys} and {@code values} are parallel; entries are evaluated key first,
 * pair by pair.
 */
public record DictLiteral(
    int lineno,
    int colOffset,
    List<Expr> keys,
    List<Expr> values
) implements Expr {

    public DictLiteral {
        keys = NodeChecks.requiredList(keys, NodeKind.DICT, "keys");
        values = NodeChecks.requiredList(values, NodeKind.DICT, "values");
        NodeChecks.sameSize(keys, values, NodeKind.DICT, "keys", "values");
    }

    public DictLiteral(List<Expr> keys, List<Expr> values) {
        this(0, 0, keys, values);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DICT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitDictLiteral(this)) {
            return;
        }
        for (int i = 0; i < keys.size(); i++) {
            keys.get(i).accept(visitor);
            values.get(i).accept(visitor);
        }
    }
}
