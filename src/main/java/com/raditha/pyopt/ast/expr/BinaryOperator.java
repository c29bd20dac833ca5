package com.raditha.pyopt.ast.expr;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binary operators with their Python spelling, ast class name and precedence.
 */
public enum BinaryOperator {
    ADD("+", "Add", Precedence.ARITH),
    SUB("-", "Sub", Precedence.ARITH),
    MULT("*", "Mult", Precedence.TERM),
    MAT_MULT("@", "MatMult", Precedence.TERM),
    DIV("/", "Div", Precedence.TERM),
    FLOOR_DIV("//", "FloorDiv", Precedence.TERM),
    MOD("%", "Mod", Precedence.TERM),
    POW("**", "Pow", Precedence.POWER),
    LSHIFT("<<", "LShift", Precedence.SHIFT),
    RSHIFT(">>", "RShift", Precedence.SHIFT),
    BIT_OR("|", "BitOr", Precedence.BIT_OR),
    BIT_XOR("^", "BitXor", Precedence.BIT_XOR),
    BIT_AND("&", "BitAnd", Precedence.BIT_AND);

    private final String symbol;
    private final String astName;
    private final int precedence;

    BinaryOperator(String symbol, String astName, int precedence) {
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

    public boolean isRightAssociative() {
        return this == POW;
    }

    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }

    /**
     * Operator of an augmented assignment token such as {@code +=}.
     */
    public static Optional<BinaryOperator> fromAugmented(String token) {
        if (!token.endsWith("=") || token.length() < 2) {
            return Optional.empty();
        }
        return fromSymbol(token.substring(0, token.length() - 1));
    }
}
