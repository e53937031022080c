package com.pyast.ast;

import com.pyast.InternalConsistencyError;

import java.util.List;

/**
 * Parameter list of a function or lambda. {@code defaults} belong to the last
 * {@code defaults.size()} entries of {@code args}.
 */
public record Arguments(
    int lineno,
    int colOffset,
    List<Expr> args,
    List<Expr> defaults,
    Name vararg,  // Can be null
    Name kwarg    // Can be null
) implements Node {

    public Arguments {
        args = NodeChecks.requiredList(args, NodeKind.ARGUMENTS, "args");
        defaults = NodeChecks.requiredList(defaults, NodeKind.ARGUMENTS, "defaults");
        if (defaults.size() > args.size()) {
            throw new InternalConsistencyError("ARGUMENTS has " + defaults.size()
                + " defaults for " + args.size() + " args");
        }
    }

    public static Arguments empty(int lineno, int colOffset) {
        return new Arguments(lineno, colOffset, List.of(), List.of(), null, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARGUMENTS;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitArguments(this)) {
            return;
        }
        // defaults are evaluated at definition time, before anything is bound
        Node.acceptAll(defaults, visitor);
        Node.acceptAll(args, visitor);
        if (kwarg != null) {
            kwarg.accept(visitor);
        }
        if (vararg != null) {
            vararg.accept(visitor);
        }
    }
}
