package com.raditha.pyopt.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits Python source into tokens.
 * <p>
 * Produces INDENT and DEDENT tokens from leading whitespace, joins physical
 * lines inside brackets and after a backslash, and drops comments and blank
 * lines. String literals are returned with their prefix and quotes intact.
 */
public class Tokenizer {

    private static final int TAB_SIZE = 8;

    /** Longest operators first so that matching is greedy. */
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", "**", "//", ">>", "<<", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=", ":=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Character> brackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean atLineStart = true;

    public Tokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenize a complete source file.
     *
     * @throws SourceParseException on a lexical error
     */
    public static List<Token> tokenize(String source) throws SourceParseException {
        return new Tokenizer(source).run();
    }

    public List<Token> run() throws SourceParseException {
        indents.push(0);
        skipByteOrderMark();

        while (pos < source.length()) {
            if (atLineStart && brackets.isEmpty()) {
                if (!readIndentation()) {
                    continue;
                }
            }
            if (pos >= source.length()) {
                break;
            }
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\n' || c == '\r') {
                int newlineColumn = column();
                consumeNewline();
                if (brackets.isEmpty()) {
                    tokens.add(new Token(TokenType.NEWLINE, "", line - 1, newlineColumn));
                    atLineStart = true;
                }
            } else if (c == '\\') {
                readContinuation();
            } else if (isIdentifierStart(c)) {
                readNameOrPrefixedString();
            } else if (Character.isDigit(c) || (c == '.' && isDigitAt(pos + 1))) {
                readNumber();
            } else if (c == '\'' || c == '"') {
                readString(pos, column());
            } else {
                readOperator();
            }
        }

        finish();
        return tokens;
    }

    /**
     * Measure the indentation of a new logical line and emit INDENT/DEDENT.
     *
     * @return false if the line was blank or a comment and has been skipped
     */
    private boolean readIndentation() throws SourceParseException {
        int width = 0;
        int p = pos;
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            p++;
        }
        pos = p;
        if (p >= source.length()) {
            return false;
        }

        char c = source.charAt(p);
        if (c == '#') {
            skipComment();
            return false;
        }
        if (c == '\n' || c == '\r') {
            consumeNewline();
            return false;
        }

        atLineStart = false;
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, "", line, 0));
        } else {
            while (width < indents.peek()) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", line, column()));
            }
            if (width != indents.peek()) {
                throw new SourceParseException("unindent does not match any outer indentation level", line, column());
            }
        }
        return true;
    }

    private void readContinuation() throws SourceParseException {
        int next = pos + 1;
        if (next < source.length() && (source.charAt(next) == '\n' || source.charAt(next) == '\r')) {
            pos = next;
            consumeNewline();
            return;
        }
        if (next >= source.length()) {
            throw new SourceParseException("unexpected EOF while parsing", line, column());
        }
        throw new SourceParseException("unexpected character after line continuation character", line, column());
    }

    private void readNameOrPrefixedString() throws SourceParseException {
        int start = pos;
        int startColumn = column();
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        String text = source.substring(start, pos);
        if (pos < source.length()
                && (source.charAt(pos) == '\'' || source.charAt(pos) == '"')
                && STRING_PREFIXES.contains(text.toLowerCase(Locale.ROOT))) {
            readString(start, startColumn);
            return;
        }
        tokens.add(new Token(TokenType.NAME, text, line, startColumn));
    }

    private void readNumber() {
        int start = pos;
        int startColumn = column();
        char first = source.charAt(pos);
        if (first == '0' && pos + 1 < source.length() && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            skipDigits();
            if (pos < source.length() && source.charAt(pos) == '.') {
                pos++;
                skipDigits();
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (isDigitAt(pos)) {
                    skipDigits();
                } else {
                    pos = mark;
                }
            }
            if (pos < source.length() && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
                pos++;
            }
        }
        tokens.add(new Token(TokenType.NUMBER, source.substring(start, pos), line, startColumn));
    }

    private void skipDigits() {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    /**
     * Read a string literal whose prefix (if any) starts at {@code start} and
     * whose opening quote is at the current position.
     */
    private void readString(int start, int startColumn) throws SourceParseException {
        int startLine = line;
        char quote = source.charAt(pos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;

        while (true) {
            if (pos >= source.length()) {
                throw new SourceParseException(triple
                        ? "unterminated triple-quoted string literal"
                        : "unterminated string literal", startLine, startColumn);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '\n' || source.charAt(pos) == '\r')) {
                    consumeNewline();
                } else {
                    pos++;
                }
            } else if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new SourceParseException("unterminated string literal", startLine, startColumn);
                }
                consumeNewline();
            } else if (c == quote && (!triple || source.startsWith(String.valueOf(quote).repeat(3), pos))) {
                pos += triple ? 3 : 1;
                break;
            } else {
                pos++;
            }
        }
        tokens.add(new Token(TokenType.STRING, source.substring(start, pos), startLine, startColumn));
    }

    private void readOperator() throws SourceParseException {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                trackBrackets(op);
                tokens.add(new Token(TokenType.OPERATOR, op, line, column()));
                pos += op.length();
                return;
            }
        }
        throw new SourceParseException("invalid character '" + source.charAt(pos) + "'", line, column());
    }

    private void trackBrackets(String op) throws SourceParseException {
        switch (op) {
            case "(", "[", "{" -> brackets.push(op.charAt(0));
            case ")", "]", "}" -> {
                if (brackets.isEmpty()) {
                    throw new SourceParseException("unmatched '" + op + "'", line, column());
                }
                char open = brackets.pop();
                if ("([{".indexOf(open) != ")]}".indexOf(op.charAt(0))) {
                    throw new SourceParseException("closing parenthesis '" + op
                            + "' does not match opening parenthesis '" + open + "'", line, column());
                }
            }
            default -> {
                // not a bracket
            }
        }
    }

    private void finish() throws SourceParseException {
        if (!brackets.isEmpty()) {
            throw new SourceParseException("unexpected EOF while parsing: '" + brackets.peek() + "' was never closed",
                    line, column());
        }
        if (!tokens.isEmpty()) {
            TokenType last = tokens.get(tokens.size() - 1).type();
            if (last != TokenType.NEWLINE && last != TokenType.DEDENT && last != TokenType.INDENT) {
                tokens.add(new Token(TokenType.NEWLINE, "", line, column()));
            }
        }
        while (indents.size() > 1) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", line, 0));
        }
        tokens.add(new Token(TokenType.END_MARKER, "", line, 0));
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
            pos++;
        }
    }

    private void consumeNewline() {
        if (source.charAt(pos) == '\r' && pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
            pos++;
        }
        pos++;
        line++;
        lineStart = pos;
    }

    private void skipByteOrderMark() {
        if (source.startsWith("﻿")) {
            pos = 1;
            lineStart = 1;
        }
    }

    private int column() {
        return pos - lineStart;
    }

    private boolean isDigitAt(int index) {
        return index < source.length() && Character.isDigit(source.charAt(index));
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
