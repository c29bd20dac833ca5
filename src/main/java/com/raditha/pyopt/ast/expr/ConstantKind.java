package com.raditha.pyopt.ast.expr;

/**
 * Literal categories. Strings keep their prefix and quotes in the literal text,
 * so f-strings and bytes print back unchanged.
 */
public enum ConstantKind {
    INTEGER,
    FLOAT,
    IMAGINARY,
    STRING,
    BYTES,
    FORMATTED_STRING,
    BOOLEAN,
    NONE,
    ELLIPSIS;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == IMAGINARY;
    }
}
