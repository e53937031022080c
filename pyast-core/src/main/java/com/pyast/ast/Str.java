package com.pyast.ast;

public record Str(
    int lineno,
    int colOffset,
    StrType strType,
    String strData
) implements Expr {

    public enum StrType {
        STR,
        UNICODE
    }

    public Str {
        NodeChecks.required(strType, NodeKind.STR, "strType");
        NodeChecks.required(strData, NodeKind.STR, "strData");
    }

    public Str(String strData) {
        this(0, 0, StrType.STR, strData);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STR;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitStr(this);
    }
}
