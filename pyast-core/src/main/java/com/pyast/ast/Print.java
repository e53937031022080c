package com.pyast.ast;

import java.util.List;

/**
 * Legacy print statement: {@code print [>>dest,] values[,]}. {@code nl} is false when the
 * statement ends with a comma.
 */
public record Print(
    int lineno,
    int colOffset,
    Expr dest,  // Can be null
    List<Expr> values,
    boolean nl
) implements Stmt {

    public Print {
        values = NodeChecks.requiredList(values, NodeKind.PRINT, "values");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PRINT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitPrint(this)) {
            return;
        }
        if (dest != null) {
            dest.accept(visitor);
        }
        Node.acceptAll(values, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitPrint(this);
    }
}
