package com.raditha.pyopt.ast;

/**
 * Source position of a node.
 *
 * @param line   line number (1-indexed)
 * @param column column offset (0-indexed, like Python's col_offset)
 */
public record Position(int line, int column) {

    public static final Position UNKNOWN = new Position(0, 0);

    public Position {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line and column must be >= 0");
        }
    }

    /**
     * Format as "L12:4" for display.
     */
    public String toDisplayString() {
        return "L" + line + ":" + column;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
