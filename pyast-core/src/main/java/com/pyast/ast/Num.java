package com.pyast.ast;

public record Num(
    int lineno,
    int colOffset,
    NumType numType,
    long nInt,
    double nFloat,   // value for FLOAT, imaginary part for COMPLEX
    String nLong     // digits of a LONG literal, null otherwise
) implements Expr {

    public enum NumType {
        INT,
        LONG,
        FLOAT,
        COMPLEX
    }

    public Num {
        NodeChecks.required(numType, NodeKind.NUM, "numType");
        if (numType == NumType.LONG) {
            NodeChecks.required(nLong, NodeKind.NUM, "nLong");
        }
    }

    public static Num ofInt(int lineno, int colOffset, long value) {
        return new Num(lineno, colOffset, NumType.INT, value, 0.0, null);
    }

    public static Num ofInt(long value) {
        return ofInt(0, 0, value);
    }

    public static Num ofLong(int lineno, int colOffset, String digits) {
        return new Num(lineno, colOffset, NumType.LONG, 0, 0.0, digits);
    }

    public static Num ofFloat(int lineno, int colOffset, double value) {
        return new Num(lineno, colOffset, NumType.FLOAT, 0, value, null);
    }

    public static Num ofComplex(int lineno, int colOffset, double imag) {
        return new Num(lineno, colOffset, NumType.COMPLEX, 0, imag, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NUM;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitNum(this);
    }
}
