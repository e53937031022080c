package com.pyast.ast;

/**
 * The forms a subscript's index can take.
 */
public sealed interface SliceExpr extends Expr permits Index, Slice, ExtSlice {
}
