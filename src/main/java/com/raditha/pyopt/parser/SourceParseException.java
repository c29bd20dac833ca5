package com.raditha.pyopt.parser;

/**
 * Thrown when source text is not valid in the supported Python grammar.
 * Carries the underlying {@link SyntaxError} with its position.
 */
public class SourceParseException extends Exception {

    private final transient SyntaxError syntaxError;

    public SourceParseException(SyntaxError syntaxError) {
        super(syntaxError.toString());
        this.syntaxError = syntaxError;
    }

    public SourceParseException(String message, int line, int column) {
        this(new SyntaxError(message, line, column));
    }

    public SyntaxError getSyntaxError() {
        return syntaxError;
    }

    public int getLine() {
        return syntaxError.line();
    }

    public int getColumn() {
        return syntaxError.column();
    }
}
