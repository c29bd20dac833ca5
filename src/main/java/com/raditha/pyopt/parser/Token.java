package com.raditha.pyopt.parser;

/**
 * A lexical token.
 *
 * @param type   category
 * @param text   exact source text (empty for synthetic tokens)
 * @param line   line number (1-indexed)
 * @param column column offset (0-indexed)
 */
public record Token(TokenType type, String text, int line, int column) {

    public boolean is(TokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    public boolean isOperator(String op) {
        return is(TokenType.OPERATOR, op);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.NAME, keyword);
    }

    /**
     * Short description for error messages.
     */
    public String describe() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case END_MARKER -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
