package com.pyast.ast;

public sealed interface Stmt extends Node permits
    Assign,
    AugAssign,
    ExprStmt,
    If,
    For,
    While,
    With,
    TryExcept,
    TryFinally,
    Raise,
    Return,
    Pass,
    Break,
    Continue,
    Global,
    Import,
    ImportFrom,
    Print,
    Exec,
    Delete,
    Assert,
    FunctionDef,
    ClassDef,
    Invoke {

    /**
     * Calls the matching handler of a statement-only visitor. Never descends.
     */
    void acceptStmt(StmtVisitor visitor);
}
