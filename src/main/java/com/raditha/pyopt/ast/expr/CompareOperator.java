package com.raditha.pyopt.ast.expr;

public enum CompareOperator {
    EQ("==", "Eq"),
    NOT_EQ("!=", "NotEq"),
    LT("<", "Lt"),
    LT_E("<=", "LtE"),
    GT(">", "Gt"),
    GT_E(">=", "GtE"),
    IS("is", "Is"),
    IS_NOT("is not", "IsNot"),
    IN("in", "In"),
    NOT_IN("not in", "NotIn");

    private final String symbol;
    private final String astName;

    CompareOperator(String symbol, String astName) {
        this.symbol = symbol;
        this.astName = astName;
    }

    public String symbol() {
        return symbol;
    }

    public String astName() {
        return astName;
    }
}
