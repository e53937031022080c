package com.pyast.ast;

/**
 * Tag identifying which construct a node represents. Fixed by the node's record type.
 */
public enum NodeKind {
    // expressions
    NUM(Family.EXPRESSION),
    STR(Family.EXPRESSION),
    ELLIPSIS(Family.EXPRESSION),
    NAME(Family.EXPRESSION),
    BIN_OP(Family.EXPRESSION),
    AUG_BIN_OP(Family.EXPRESSION),
    BOOL_OP(Family.EXPRESSION),
    UNARY_OP(Family.EXPRESSION),
    COMPARE(Family.EXPRESSION),
    CALL(Family.EXPRESSION),
    ATTRIBUTE(Family.EXPRESSION),
    CLS_ATTRIBUTE(Family.EXPRESSION),
    SUBSCRIPT(Family.EXPRESSION),
    INDEX(Family.EXPRESSION),
    SLICE(Family.EXPRESSION),
    EXT_SLICE(Family.EXPRESSION),
    LIST(Family.EXPRESSION),
    TUPLE(Family.EXPRESSION),
    SET(Family.EXPRESSION),
    DICT(Family.EXPRESSION),
    LIST_COMP(Family.EXPRESSION, true),
    SET_COMP(Family.EXPRESSION, true),
    DICT_COMP(Family.EXPRESSION, true),
    GENERATOR_EXP(Family.EXPRESSION, true),
    LAMBDA(Family.EXPRESSION, true),
    IF_EXP(Family.EXPRESSION),
    YIELD(Family.EXPRESSION),
    REPR(Family.EXPRESSION),
    LANG_PRIMITIVE(Family.EXPRESSION),

    // statements
    ASSIGN(Family.STATEMENT),
    AUG_ASSIGN(Family.STATEMENT),
    EXPR(Family.STATEMENT),
    IF(Family.STATEMENT),
    FOR(Family.STATEMENT),
    WHILE(Family.STATEMENT),
    WITH(Family.STATEMENT),
    TRY_EXCEPT(Family.STATEMENT),
    TRY_FINALLY(Family.STATEMENT),
    RAISE(Family.STATEMENT),
    RETURN(Family.STATEMENT),
    PASS(Family.STATEMENT),
    BREAK(Family.STATEMENT),
    CONTINUE(Family.STATEMENT),
    GLOBAL(Family.STATEMENT),
    IMPORT(Family.STATEMENT),
    IMPORT_FROM(Family.STATEMENT),
    PRINT(Family.STATEMENT),
    EXEC(Family.STATEMENT),
    DELETE(Family.STATEMENT),
    ASSERT(Family.STATEMENT),
    FUNCTION_DEF(Family.STATEMENT, true),
    CLASS_DEF(Family.STATEMENT, true),
    INVOKE(Family.STATEMENT),

    // records that only appear inside other nodes
    ALIAS(Family.AUXILIARY),
    ARGUMENTS(Family.AUXILIARY),
    KEYWORD(Family.AUXILIARY),
    COMPREHENSION(Family.AUXILIARY),
    EXCEPT_HANDLER(Family.AUXILIARY),

    // roots
    PROGRAM(Family.ROOT, true),
    EXPRESSION(Family.ROOT),
    SUITE(Family.ROOT);

    public enum Family {
        EXPRESSION,
        STATEMENT,
        AUXILIARY,
        ROOT
    }

    private final Family family;
    private final boolean scopeBoundary;

    NodeKind(Family family) {
        this(family, false);
    }

    NodeKind(Family family, boolean scopeBoundary) {
        this.family = family;
        this.scopeBoundary = scopeBoundary;
    }

    public Family family() {
        return family;
    }

    /**
     * Whether nodes of this kind open a new variable-binding scope.
     */
    public boolean isScopeBoundary() {
        return scopeBoundary;
    }
}
