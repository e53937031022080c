package com.pyast.ast;

public sealed interface Expr extends Node permits
    Num,
    Str,
    Ellipsis,
    Name,
    BinOp,
    AugBinOp,
    BoolOp,
    UnaryOp,
    Compare,
    Call,
    Attribute,
    ClsAttribute,
    Subscript,
    SliceExpr,
    ListLiteral,
    TupleLiteral,
    SetLiteral,
    DictLiteral,
    ListComp,
    SetComp,
    DictComp,
    GeneratorExp,
    Lambda,
    IfExp,
    Yield,
    Repr,
    LangPrimitive {
}
