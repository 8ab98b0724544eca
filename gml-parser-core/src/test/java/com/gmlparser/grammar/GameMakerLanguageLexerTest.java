package com.gmlparser.grammar;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GameMakerLanguageLexerTest {

    private static List<TokenType> significantTypes(String source) {
        List<TokenType> types = new ArrayList<>();
        for (Token token : new GameMakerLanguageLexer(source).tokenize()) {
            if (!token.isHidden()) {
                types.add(token.type());
            }
        }
        return types;
    }

    @Test
    void testWordOperators() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.COLON_ASSIGN, TokenType.IDENTIFIER,
                TokenType.INTEGER_DIVIDE, TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.EOF),
            significantTypes("x := a div b;"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.AND, TokenType.NOT, TokenType.IDENTIFIER, TokenType.EOF),
            significantTypes("a and not b"));
    }

    @Test
    void testBeginEndAreBraces() {
        assertEquals(List.of(TokenType.OPEN_BRACE, TokenType.CLOSE_BRACE, TokenType.EOF),
            significantTypes("begin end"));
    }

    @Test
    void testAccessorsAndNumberForms() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ARRAY_ACCESSOR, TokenType.INTEGER_LITERAL,
                TokenType.CLOSE_BRACKET, TokenType.ASSIGN, TokenType.HEX_INTEGER_LITERAL, TokenType.PLUS,
                TokenType.BINARY_LITERAL, TokenType.PLUS, TokenType.DECIMAL_LITERAL, TokenType.SEMICOLON,
                TokenType.EOF),
            significantTypes("arr[@ 0] = $FF + 0b101 + 1.5;"));
        assertEquals(TokenType.MAP_ACCESSOR, significantTypes("m[? k]").get(1));
        assertEquals(TokenType.GRID_ACCESSOR, significantTypes("g[# 0, 1]").get(1));
    }

    @Test
    void testHiddenTokensStayInStream() {
        List<Token> tokens = new GameMakerLanguageLexer("a // c\nb").tokenize();

        List<TokenType> types = new ArrayList<>();
        for (Token token : tokens) {
            types.add(token.type());
        }
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.WHITESPACE, TokenType.SINGLE_LINE_COMMENT,
            TokenType.LINE_TERMINATOR, TokenType.IDENTIFIER, TokenType.EOF), types);

        Token b = tokens.get(4);
        assertEquals(2, b.line());
        assertEquals(0, b.column());
        assertEquals(7, b.startIndex());
        assertEquals(7, b.stopIndex());
    }

    @Test
    void testEofTokenSitsPastTheLastCharacter() {
        List<Token> tokens = new GameMakerLanguageLexer("x;").tokenize();
        Token eof = tokens.get(tokens.size() - 1);
        assertTrue(eof.isEof());
        assertEquals(Token.EOF_TEXT, eof.text());
        assertEquals(2, eof.startIndex());
        assertEquals(1, eof.stopIndex());
    }

    @Test
    void testTemplateString() {
        List<Token> tokens = new GameMakerLanguageLexer("$\"a{b}c\"").tokenize();
        List<TokenType> types = new ArrayList<>();
        for (Token token : tokens) {
            types.add(token.type());
        }
        assertEquals(List.of(TokenType.TEMPLATE_STRING_START, TokenType.TEMPLATE_STRING_TEXT,
            TokenType.TEMPLATE_STRING_START_EXPRESSION, TokenType.IDENTIFIER,
            TokenType.TEMPLATE_STRING_END_EXPRESSION, TokenType.TEMPLATE_STRING_TEXT,
            TokenType.TEMPLATE_STRING_END, TokenType.EOF), types);
        assertEquals("a", tokens.get(1).text());
        assertEquals("c", tokens.get(5).text());
    }

    @Test
    void testRegionNameIsOneToken() {
        List<Token> tokens = new GameMakerLanguageLexer("#region Player stuff\n").tokenize();
        assertEquals(TokenType.REGION, tokens.get(0).type());
        assertEquals(TokenType.WHITESPACE, tokens.get(1).type());
        assertEquals(TokenType.REGION_CHARACTERS, tokens.get(2).type());
        assertEquals("Player stuff", tokens.get(2).text());
        assertEquals(TokenType.LINE_TERMINATOR, tokens.get(3).type());
    }

    @Test
    void testCrLfIsOneLineTerminator() {
        List<Token> tokens = new GameMakerLanguageLexer("a\r\nb").tokenize();
        assertEquals(TokenType.LINE_TERMINATOR, tokens.get(1).type());
        assertEquals("\r\n", tokens.get(1).text());
        assertEquals(2, tokens.get(2).line());
    }

    @Test
    void testUnknownCharacterFails() {
        RecognitionException e = assertThrows(RecognitionException.class,
            () -> new GameMakerLanguageLexer("x = `;").tokenize());
        assertTrue(e.getMessage().contains("token recognition error"), e.getMessage());
    }

    @Test
    void testUnterminatedBlockCommentFails() {
        assertThrows(RecognitionException.class, () -> new GameMakerLanguageLexer("/* open").tokenize());
    }

    @Test
    void testLineBreakCounting() {
        assertEquals(0, LineBreaks.count("abc"));
        assertEquals(2, LineBreaks.count("a\nb\r\nc"));
        assertEquals(0, LineBreaks.count(null));
    }
}
