package com.raditha.pyopt.parser;

/**
 * Token categories produced by {@link Tokenizer}.
 */
public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OPERATOR,
    /** end of a logical line */
    NEWLINE,
    INDENT,
    DEDENT,
    END_MARKER
}
