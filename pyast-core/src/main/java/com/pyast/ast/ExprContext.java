package com.pyast.ast;

/**
 * How a name, attribute, subscript or unpacking target is used.
 */
public enum ExprContext {
    LOAD,
    STORE,
    DEL,
    PARAM
}
