package com.raditha.pyopt.ast.expr;

public enum BoolOperator {
    AND("and", "And", Precedence.AND),
    OR("or", "Or", Precedence.OR);

    private final String keyword;
    private final String astName;
    private final int precedence;

    BoolOperator(String keyword, String astName, int precedence) {
        this.keyword = keyword;
        this.astName = astName;
        this.precedence = precedence;
    }

    public String keyword() {
        return keyword;
    }

    public String astName() {
        return astName;
    }

    public int precedence() {
        return precedence;
    }
}
