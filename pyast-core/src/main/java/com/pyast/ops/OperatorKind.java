package com.pyast.ops;

/**
 * The closed set of operator tags carried by operator nodes.
 */
public enum OperatorKind {
    ADD(OperatorCategory.BINARY),
    SUB(OperatorCategory.BINARY),
    MULT(OperatorCategory.BINARY),
    DIV(OperatorCategory.BINARY),
    TRUE_DIV(OperatorCategory.BINARY),
    FLOOR_DIV(OperatorCategory.BINARY),
    MOD(OperatorCategory.BINARY),
    POW(OperatorCategory.BINARY),
    DIV_MOD(OperatorCategory.BINARY),
    LSHIFT(OperatorCategory.BINARY),
    RSHIFT(OperatorCategory.BINARY),
    BIT_AND(OperatorCategory.BINARY),
    BIT_OR(OperatorCategory.BINARY),
    BIT_XOR(OperatorCategory.BINARY),

    EQ(OperatorCategory.COMPARISON),
    NOT_EQ(OperatorCategory.COMPARISON),
    LT(OperatorCategory.COMPARISON),
    LT_E(OperatorCategory.COMPARISON),
    GT(OperatorCategory.COMPARISON),
    GT_E(OperatorCategory.COMPARISON),

    IS(OperatorCategory.IDENTITY),
    IS_NOT(OperatorCategory.IDENTITY),

    IN(OperatorCategory.CONTAINMENT),
    NOT_IN(OperatorCategory.CONTAINMENT),

    AND(OperatorCategory.BOOLEAN),
    OR(OperatorCategory.BOOLEAN),

    INVERT(OperatorCategory.UNARY),
    NOT(OperatorCategory.UNARY),
    UADD(OperatorCategory.UNARY),
    USUB(OperatorCategory.UNARY);

    private final OperatorCategory category;

    OperatorKind(OperatorCategory category) {
        this.category = category;
    }

    public OperatorCategory category() {
        return category;
    }

    /**
     * Operators that may appear between operands of a comparison chain.
     */
    public boolean isComparator() {
        return category == OperatorCategory.COMPARISON
            || category == OperatorCategory.IDENTITY
            || category == OperatorCategory.CONTAINMENT;
    }
}
