package com.pyast.ast;

import java.util.List;

public record GeneratorExp(
    int lineno,
    int colOffset,
    Expr elt,
    List<Comprehension> generators
) implements Expr {

    public GeneratorExp {
        NodeChecks.required(elt, NodeKind.GENERATOR_EXP, "elt");
        generators = NodeChecks.nonEmptyList(generators, NodeKind.GENERATOR_EXP, "generators");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GENERATOR_EXP;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitGeneratorExp(this)) {
            return;
        }
        Node.acceptAll(generators, visitor);
        elt.accept(visitor);
    }
}
