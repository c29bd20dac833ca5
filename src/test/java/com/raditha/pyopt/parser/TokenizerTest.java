package com.raditha.pyopt.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static List<TokenType> types(String source) throws SourceParseException {
        return Tokenizer.tokenize(source).stream().map(Token::type).toList();
    }

    @Test
    void testEmptySource_OnlyEndMarker() throws SourceParseException {
        assertEquals(List.of(TokenType.END_MARKER), types(""));
        assertEquals(List.of(TokenType.END_MARKER), types("\n\n# just a comment\n"));
    }

    @Test
    void testSimpleStatement() throws SourceParseException {
        List<Token> tokens = Tokenizer.tokenize("x = 1\n");
        assertEquals(5, tokens.size());
        assertEquals(new Token(TokenType.NAME, "x", 1, 0), tokens.get(0));
        assertEquals(new Token(TokenType.OPERATOR, "=", 1, 2), tokens.get(1));
        assertEquals(new Token(TokenType.NUMBER, "1", 1, 4), tokens.get(2));
        assertEquals(TokenType.NEWLINE, tokens.get(3).type());
        assertEquals(TokenType.END_MARKER, tokens.get(4).type());
    }

    @Test
    void testIndentAndDedent() throws SourceParseException {
        assertEquals(List.of(
                TokenType.NAME, TokenType.NAME, TokenType.OPERATOR, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.END_MARKER),
                types("if x:\n    y\n"));
    }

    @Test
    void testMissingFinalNewline_IsSupplied() throws SourceParseException {
        assertEquals(types("x = 1\n"), types("x = 1"));
    }

    @Test
    void testBracketsJoinLines() throws SourceParseException {
        List<Token> tokens = Tokenizer.tokenize("x = (1,\n     2)\n");
        long newlines = tokens.stream().filter(t -> t.type() == TokenType.NEWLINE).count();
        assertEquals(1, newlines);
        assertEquals(new Token(TokenType.NUMBER, "2", 2, 5), tokens.get(5));
    }

    @Test
    void testBackslashContinuation() throws SourceParseException {
        assertEquals(types("x = 1 + 2\n"), types("x = 1 + \\\n    2\n"));
    }

    @Test
    void testCommentsAndBlankLinesInsideBlock() throws SourceParseException {
        String source = "for i in x:\n    a = 1\n\n    # note\n    b = 2\n";
        long indents = Tokenizer.tokenize(source).stream().filter(t -> t.type() == TokenType.INDENT).count();
        assertEquals(1, indents);
    }

    @Test
    void testLongestOperatorMatch() throws SourceParseException {
        List<Token> tokens = Tokenizer.tokenize("a **= b // c\n");
        assertEquals("**=", tokens.get(1).text());
        assertEquals("//", tokens.get(3).text());
    }

    @Test
    void testStringPrefixesAndTripleQuotes() throws SourceParseException {
        List<Token> tokens = Tokenizer.tokenize("s = rb'\\d' + f\"{x}\" + '''a\nb'''\n");
        assertEquals(new Token(TokenType.STRING, "rb'\\d'", 1, 4), tokens.get(2));
        assertEquals("f\"{x}\"", tokens.get(4).text());
        assertEquals("'''a\nb'''", tokens.get(6).text());
    }

    @Test
    void testNumberForms() throws SourceParseException {
        List<String> numbers = Tokenizer.tokenize("a = [0x1F, 0o17, 0b101, 1_000, 3.14, 1e-3, .5, 2j]\n").stream()
                .filter(t -> t.type() == TokenType.NUMBER)
                .map(Token::text)
                .toList();
        assertEquals(List.of("0x1F", "0o17", "0b101", "1_000", "3.14", "1e-3", ".5", "2j"), numbers);
    }

    @Test
    void testUnterminatedString() {
        SourceParseException e = assertThrows(SourceParseException.class, () -> Tokenizer.tokenize("x = 'abc\n"));
        assertEquals("unterminated string literal", e.getSyntaxError().message());
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
    }

    @Test
    void testInconsistentDedent() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> Tokenizer.tokenize("if x:\n    y\n  z\n"));
        assertEquals("unindent does not match any outer indentation level", e.getSyntaxError().message());
        assertEquals(3, e.getLine());
    }

    @Test
    void testMismatchedBrackets() {
        SourceParseException e = assertThrows(SourceParseException.class, () -> Tokenizer.tokenize("x = (1]\n"));
        assertTrue(e.getMessage().contains("does not match"));

        e = assertThrows(SourceParseException.class, () -> Tokenizer.tokenize("x = [1, 2\n"));
        assertTrue(e.getMessage().contains("was never closed"));
    }
}
