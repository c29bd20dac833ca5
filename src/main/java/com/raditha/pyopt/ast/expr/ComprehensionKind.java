package com.raditha.pyopt.ast.expr;

public enum ComprehensionKind {
    LIST("[", "]"),
    SET("{", "}"),
    DICT("{", "}"),
    GENERATOR("(", ")");

    private final String open;
    private final String close;

    ComprehensionKind(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }
}
