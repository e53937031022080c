package com.pyast.ast;

import java.util.List;

/**
 * A function definition. A null {@code name} marks a function synthesized from a lambda.
 */
public record FunctionDef(
    int lineno,
    int colOffset,
    InternedString name,  // Can be null
    Arguments args,
    List<Expr> decoratorList,
    List<Stmt> body
) implements Stmt {

    public FunctionDef {
        NodeChecks.required(args, NodeKind.FUNCTION_DEF, "args");
        decoratorList = NodeChecks.requiredList(decoratorList, NodeKind.FUNCTION_DEF, "decoratorList");
        body = NodeChecks.nonEmptyList(body, NodeKind.FUNCTION_DEF, "body");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_DEF;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitFunctionDef(this)) {
            return;
        }
        Node.acceptAll(decoratorList, visitor);
        args.accept(visitor);
        Node.acceptAll(body, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitFunctionDef(this);
    }
}
