package com.pyast.ast;

import com.pyast.InternalConsistencyError;

import java.util.List;
import java.util.Optional;

/**
 * Queries over the node kinds that own a body, a scope or an identifier pool.
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    /**
     * The statement body of a class, function, module or suite.
     *
     * @throws InternalConsistencyError for any other kind
     */
    public static List<Stmt> body(Node node) {
        if (node instanceof ClassDef classDef) {
            return classDef.body();
        }
        if (node instanceof FunctionDef functionDef) {
            return functionDef.body();
        }
        if (node instanceof Program program) {
            return program.body();
        }
        if (node instanceof Suite suite) {
            return suite.body();
        }
        throw new InternalConsistencyError(node.kind() + " has no statement body");
    }

    /**
     * The name a scope reports in tracebacks.
     *
     * @throws InternalConsistencyError if {@code node} does not introduce a named scope
     */
    public static String scopeName(Node node) {
        if (node instanceof ClassDef classDef) {
            return classDef.name().s();
        }
        if (node instanceof FunctionDef functionDef) {
            return functionDef.name() == null ? "<lambda>" : functionDef.name().s();
        }
        if (node instanceof Lambda) {
            return "<lambda>";
        }
        if (node instanceof Program || node instanceof Expression || node instanceof Suite) {
            return "<module>";
        }
        throw new InternalConsistencyError(node.kind() + " does not name a scope");
    }

    /**
     * The docstring of a body: its first statement, when that is a bare string constant.
     */
    public static Optional<String> docString(List<Stmt> body) {
        if (body.isEmpty()) {
            return Optional.empty();
        }
        if (body.get(0) instanceof ExprStmt exprStmt && exprStmt.value() instanceof Str str) {
            return Optional.of(str.strData());
        }
        return Optional.empty();
    }

    /**
     * The identifier pool owned by a module or expression root.
     *
     * @throws InternalConsistencyError for any other kind
     */
    public static InternedStringPool stringPool(Node node) {
        if (node instanceof Program program) {
            return program.stringPool();
        }
        if (node instanceof Expression expression) {
            return expression.stringPool();
        }
        throw new InternalConsistencyError(node.kind() + " does not own an identifier pool");
    }
}
