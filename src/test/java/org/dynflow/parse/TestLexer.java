package org.dynflow.parse;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TestLexer {

    private static List<TokenType> types(String src) {
        return Lexer.tokenize(src).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    public void testIndentation() {
        String src = """
                if x:
                    y = 1
                z = 2
                """;
        assertEquals(List.of(
                TokenType.KEYWORD, TokenType.NAME, TokenType.OP, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.OP, TokenType.INT, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.NAME, TokenType.OP, TokenType.INT, TokenType.NEWLINE,
                TokenType.END), types(src));
    }

    @Test
    public void testBlankAndCommentLinesAreSkipped() {
        String src = "a = 1\n\n   # comment\n\nb = 2  # trailing\n";
        List<Token> tokens = Lexer.tokenize(src);
        Token b = tokens.stream().filter(t -> t.text().equals("b")).findFirst().orElseThrow();
        assertEquals(5, b.line());
        assertEquals(1, b.column());
        assertFalse(tokens.stream().anyMatch(t -> t.type() == TokenType.INDENT));
    }

    @Test
    public void testNoNewlineInsideBrackets() {
        String src = "x = [1,\n     2]\ny = x\n";
        long newlines = Lexer.tokenize(src).stream().filter(t -> t.type() == TokenType.NEWLINE).count();
        assertEquals(2, newlines);
    }

    @Test
    public void testBackslashContinuation() {
        List<Token> tokens = Lexer.tokenize("x = 1 + \\\n    2\n");
        Token two = tokens.stream().filter(t -> "2".equals(t.text())).findFirst().orElseThrow();
        assertEquals(2, two.line());
        assertEquals(1, tokens.stream().filter(t -> t.type() == TokenType.NEWLINE).count());
    }

    @Test
    public void testNumbers() {
        List<Token> tokens = Lexer.tokenize("a = 0x1F + 0b101 + 1_000 + 2.5 + 1e3\n");
        List<Object> values = tokens.stream()
                .filter(t -> t.type() == TokenType.INT || t.type() == TokenType.FLOAT)
                .map(Token::value)
                .collect(Collectors.toList());
        assertEquals(List.of(31L, 5L, 1000L, 2.5, 1000.0), values);
    }

    @Test
    public void testStrings() {
        List<Token> tokens = Lexer.tokenize("s = 'a\\tb' + r'\\n' + \"\"\"x\ny\"\"\"\n");
        List<Object> values = tokens.stream()
                .filter(t -> t.type() == TokenType.STRING)
                .map(Token::value)
                .collect(Collectors.toList());
        assertEquals(List.of("a\tb", "\\n", "x\ny"), values);
    }

    @Test
    public void testKeywordsAndOperators() {
        List<Token> tokens = Lexer.tokenize("x **= y // 2\n");
        assertTrue(tokens.get(1).isOp("**="));
        assertTrue(tokens.get(3).isOp("//"));
        assertTrue(Lexer.tokenize("not x\n").get(0).isKeyword("not"));
    }

    @Test
    public void testErrors() {
        ParseError e = assertThrows(ParseError.class, () -> Lexer.tokenize("s = 'abc\n"));
        assertEquals(1, e.getLine());
        assertThrows(ParseError.class, () -> Lexer.tokenize("x = (1, 2\n"));
        assertThrows(ParseError.class, () -> Lexer.tokenize("x = 1)\n"));
        assertThrows(ParseError.class, () -> Lexer.tokenize("x = 1 $ 2\n"));
        ParseError indent = assertThrows(ParseError.class,
                () -> Lexer.tokenize("if x:\n        a = 1\n    b = 2\n"));
        assertEquals(3, indent.getLine());
    }
}
