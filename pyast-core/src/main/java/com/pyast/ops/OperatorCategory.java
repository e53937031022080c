package com.pyast.ops;

/**
 * Groups operators by the dispatch protocol the runtime uses for them.
 */
public enum OperatorCategory {
    /** Arithmetic, bitwise and shift operators: have in-place and mechanically reversed names. */
    BINARY,
    /** Equality and ordering comparisons: reversed through an explicit swap table. */
    COMPARISON,
    /** {@code is} and {@code is not}: no special method fallback at all. */
    IDENTITY,
    /** {@code in} and {@code not in}: dispatched on the right operand's {@code __contains__}. */
    CONTAINMENT,
    /** Short-circuiting {@code and} / {@code or}: truth-test each operand. */
    BOOLEAN,
    UNARY
}
