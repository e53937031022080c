package com.pyast.ast;

import java.util.List;

/**
 * A runtime operation with no surface syntax, introduced while lowering statements such as
 * {@code for}, {@code import} and {@code try}.
 */
public record LangPrimitive(
    int lineno,
    int colOffset,
    Opcode opcode,
    List<Expr> args
) implements Expr {

    public enum Opcode {
        CHECK_EXC_MATCH,
        LANDINGPAD,
        LOCALS,
        GET_ITER,
        IMPORT_FROM,
        IMPORT_NAME,
        IMPORT_STAR,
        NONE,
        NONZERO,
        SET_EXC_INFO,
        UNCACHE_EXC_INFO,
        HASNEXT,
        PRINT_EXPR
    }

    public LangPrimitive {
        NodeChecks.required(opcode, NodeKind.LANG_PRIMITIVE, "opcode");
        args = NodeChecks.requiredList(args, NodeKind.LANG_PRIMITIVE, "args");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LANG_PRIMITIVE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (!visitor.visitLangPrimitive(this)) {
            return;
        }
        Node.acceptAll(args, visitor);
    }
}
