package com.raditha.pyopt.parser;

/**
 * The grammar error behind a failed parse.
 *
 * @param message description in the style of Python's SyntaxError
 * @param line    line number (1-indexed)
 * @param column  column offset (0-indexed)
 */
public record SyntaxError(String message, int line, int column) {

    @Override
    public String toString() {
        return message + " (line " + line + ", column " + column + ")";
    }
}
