package com.pyast.ast;

import com.pyast.InternalConsistencyError;

import java.util.List;

/**
 * {@code from module import names}. {@code level} counts the leading dots of a relative import.
 */
public record ImportFrom(
    int lineno,
    int colOffset,
    InternedString module,
    List<Alias> names,
    int level
) implements Stmt {

    public ImportFrom {
        NodeChecks.required(module, NodeKind.IMPORT_FROM, "module");
        names = NodeChecks.nonEmptyList(names, NodeKind.IMPORT_FROM, "names");
        if (level < 0) {
            throw new InternalConsistencyError("IMPORT_FROM has negative level " + level);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT_FROM;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitImportFrom(this)) {
            return;
        }
        Node.acceptAll(names, visitor);
    }

    @Override
    public void acceptStmt(StmtVisitor visitor) {
        visitor.visitImportFrom(this);
    }
}
