package com.raditha.pyopt.ast.expr;

public enum UnaryOperator {
    NOT("not ", "Not", Precedence.NOT),
    U_ADD("+", "UAdd", Precedence.UNARY),
    U_SUB("-", "USub", Precedence.UNARY),
    INVERT("~", "Invert", Precedence.UNARY);

    private final String symbol;
    private final String astName;
    private final int precedence;

    UnaryOperator(String symbol, String astName, int precedence) {
        this.symbol = symbol;
        this.astName = astName;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public String astName() {
        return astName;
    }

    public int precedence() {
        return precedence;
    }
}
