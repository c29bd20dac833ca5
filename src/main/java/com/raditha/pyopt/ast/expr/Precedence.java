package com.raditha.pyopt.ast.expr;

/**
 * Binding strength of Python expressions, weakest first. The printer wraps a
 * sub-expression in parentheses when it binds more weakly than its context
 * requires.
 */
public final class Precedence {

    public static final int YIELD = 0;
    public static final int TUPLE = 1;
    public static final int LAMBDA = 2;
    public static final int IF_EXP = 3;
    public static final int OR = 4;
    public static final int AND = 5;
    public static final int NOT = 6;
    public static final int COMPARE = 7;
    public static final int BIT_OR = 8;
    public static final int BIT_XOR = 9;
    public static final int BIT_AND = 10;
    public static final int SHIFT = 11;
    public static final int ARITH = 12;
    public static final int TERM = 13;
    public static final int UNARY = 14;
    public static final int POWER = 15;
    public static final int AWAIT = 16;
    public static final int ATOM = 17;

    private Precedence() {
    }
}
