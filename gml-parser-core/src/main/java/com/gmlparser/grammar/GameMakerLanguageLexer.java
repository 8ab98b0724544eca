package com.gmlparser.grammar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Splits GML source into tokens. Hidden tokens (comments, whitespace runs and line
 * terminators) are kept in the stream so comment handling can see them; the parser
 * filters them out.
 */
public class GameMakerLanguageLexer implements Recognizer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        entry("if", TokenType.IF),
        entry("then", TokenType.THEN),
        entry("else", TokenType.ELSE),
        entry("do", TokenType.DO),
        entry("until", TokenType.UNTIL),
        entry("while", TokenType.WHILE),
        entry("for", TokenType.FOR),
        entry("repeat", TokenType.REPEAT),
        entry("with", TokenType.WITH),
        entry("switch", TokenType.SWITCH),
        entry("case", TokenType.CASE),
        entry("default", TokenType.DEFAULT),
        entry("break", TokenType.BREAK),
        entry("continue", TokenType.CONTINUE),
        entry("exit", TokenType.EXIT),
        entry("return", TokenType.RETURN),
        entry("throw", TokenType.THROW),
        entry("try", TokenType.TRY),
        entry("catch", TokenType.CATCH),
        entry("finally", TokenType.FINALLY),
        entry("delete", TokenType.DELETE),
        entry("new", TokenType.NEW),
        entry("var", TokenType.VAR),
        entry("static", TokenType.STATIC),
        entry("globalvar", TokenType.GLOBALVAR),
        entry("function", TokenType.FUNCTION),
        entry("constructor", TokenType.CONSTRUCTOR),
        entry("enum", TokenType.ENUM),
        entry("begin", TokenType.OPEN_BRACE),
        entry("end", TokenType.CLOSE_BRACE),
        entry("div", TokenType.INTEGER_DIVIDE),
        entry("mod", TokenType.MODULUS),
        entry("and", TokenType.AND),
        entry("or", TokenType.OR),
        entry("not", TokenType.NOT),
        entry("true", TokenType.BOOLEAN_LITERAL),
        entry("false", TokenType.BOOLEAN_LITERAL),
        entry("undefined", TokenType.UNDEFINED_LITERAL),
        entry("noone", TokenType.NOONE_LITERAL)
    );

    private static final Map<String, TokenType> DIRECTIVES = Map.of(
        "#macro", TokenType.MACRO,
        "#define", TokenType.DEFINE,
        "#region", TokenType.REGION,
        "#endregion", TokenType.END_REGION
    );

    // Longest operators first so that startsWith() picks the greedy match.
    private static final Map<String, TokenType> OPERATORS = new LinkedHashMap<>();

    static {
        OPERATORS.put("<<=", TokenType.LEFT_SHIFT_ASSIGN);
        OPERATORS.put(">>=", TokenType.RIGHT_SHIFT_ASSIGN);
        OPERATORS.put("??=", TokenType.NULL_COALESCE_ASSIGN);
        OPERATORS.put("++", TokenType.PLUS_PLUS);
        OPERATORS.put("--", TokenType.MINUS_MINUS);
        OPERATORS.put("==", TokenType.EQUALS);
        OPERATORS.put("!=", TokenType.NOT_EQUALS);
        OPERATORS.put("<>", TokenType.NOT_EQUALS);
        OPERATORS.put("<=", TokenType.LESS_THAN_EQUALS);
        OPERATORS.put(">=", TokenType.GREATER_THAN_EQUALS);
        OPERATORS.put("<<", TokenType.LEFT_SHIFT);
        OPERATORS.put(">>", TokenType.RIGHT_SHIFT);
        OPERATORS.put("&&", TokenType.AND);
        OPERATORS.put("||", TokenType.OR);
        OPERATORS.put("??", TokenType.NULL_COALESCE);
        OPERATORS.put("+=", TokenType.PLUS_ASSIGN);
        OPERATORS.put("-=", TokenType.MINUS_ASSIGN);
        OPERATORS.put("*=", TokenType.MULTIPLY_ASSIGN);
        OPERATORS.put("/=", TokenType.DIVIDE_ASSIGN);
        OPERATORS.put("%=", TokenType.MODULUS_ASSIGN);
        OPERATORS.put("&=", TokenType.BIT_AND_ASSIGN);
        OPERATORS.put("|=", TokenType.BIT_OR_ASSIGN);
        OPERATORS.put("^=", TokenType.BIT_XOR_ASSIGN);
        OPERATORS.put(":=", TokenType.COLON_ASSIGN);
        OPERATORS.put("[|", TokenType.LIST_ACCESSOR);
        OPERATORS.put("[?", TokenType.MAP_ACCESSOR);
        OPERATORS.put("[#", TokenType.GRID_ACCESSOR);
        OPERATORS.put("[@", TokenType.ARRAY_ACCESSOR);
        OPERATORS.put("[$", TokenType.STRUCT_ACCESSOR);
        OPERATORS.put("+", TokenType.PLUS);
        OPERATORS.put("-", TokenType.MINUS);
        OPERATORS.put("*", TokenType.MULTIPLY);
        OPERATORS.put("/", TokenType.DIVIDE);
        OPERATORS.put("%", TokenType.MODULUS);
        OPERATORS.put("<", TokenType.LESS_THAN);
        OPERATORS.put(">", TokenType.GREATER_THAN);
        OPERATORS.put("=", TokenType.ASSIGN);
        OPERATORS.put("!", TokenType.NOT);
        OPERATORS.put("~", TokenType.BIT_NOT);
        OPERATORS.put("&", TokenType.BIT_AND);
        OPERATORS.put("|", TokenType.BIT_OR);
        OPERATORS.put("^", TokenType.BIT_XOR);
        OPERATORS.put("?", TokenType.QUESTION_MARK);
        OPERATORS.put(":", TokenType.COLON);
        OPERATORS.put(".", TokenType.DOT);
        OPERATORS.put(",", TokenType.COMMA);
        OPERATORS.put(";", TokenType.SEMICOLON);
        OPERATORS.put("(", TokenType.OPEN_PAREN);
        OPERATORS.put(")", TokenType.CLOSE_PAREN);
        OPERATORS.put("[", TokenType.OPEN_BRACKET);
        OPERATORS.put("]", TokenType.CLOSE_BRACKET);
        OPERATORS.put("\\", TokenType.BACKSLASH);
    }

    /**
     * One entry per open template string. While {@code inText} the lexer reads literal
     * text; otherwise it is inside an interpolated expression and counts braces.
     */
    private static final class TemplateFrame {
        boolean inText = true;
        int braceDepth = 0;
    }

    private final String source;
    private final List<SyntaxErrorListener> listeners = new ArrayList<>();
    private final Deque<TemplateFrame> templates = new ArrayDeque<>();

    private int position = 0;
    private int line = 1;
    private int column = 0;

    // Start of the token being scanned
    private int tokenStart;
    private int tokenLine;
    private int tokenColumn;

    // Set after #region, #endregion and #define: the rest of the line is one token
    private boolean regionTextPending = false;

    public GameMakerLanguageLexer(String source) {
        this.source = source;
    }

    /**
     * Lexes the whole input, hidden tokens included, and appends the EOF token.
     *
     * @throws RecognitionException on the first character sequence that is not a token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (position < source.length()) {
            tokens.add(nextToken());
        }
        markStart();
        if (!templates.isEmpty()) {
            throw error(Token.EOF_TEXT);
        }
        tokens.add(new Token(TokenType.EOF, Token.EOF_TEXT, line, column, source.length(), source.length() - 1));
        return tokens;
    }

    @Override
    public List<String> getRuleInvocationStack() {
        return Collections.emptyList();
    }

    @Override
    public ParseNode getContext() {
        return null;
    }

    @Override
    public void addErrorListener(SyntaxErrorListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeErrorListeners() {
        listeners.clear();
    }

    // ========================================================================
    // Scanning
    // ========================================================================

    private Token nextToken() {
        markStart();

        TemplateFrame frame = templates.peek();
        if (frame != null && frame.inText) {
            return templateText(frame);
        }

        char c = peekChar(0);

        if (regionTextPending) {
            if (isInlineWhitespace(c)) {
                while (position < source.length() && isInlineWhitespace(peekChar(0))) {
                    advance();
                }
                return makeToken(TokenType.WHITESPACE);
            }
            regionTextPending = false;
            if (!isLineTerminator(c)) {
                while (position < source.length() && !isLineTerminator(peekChar(0))) {
                    advance();
                }
                return makeToken(TokenType.REGION_CHARACTERS);
            }
        }

        if (isInlineWhitespace(c)) {
            while (position < source.length() && isInlineWhitespace(peekChar(0))) {
                advance();
            }
            return makeToken(TokenType.WHITESPACE);
        }

        if (isLineTerminator(c)) {
            advance();
            if (c == '\r' && peekChar(0) == '\n') {
                advance();
            }
            return makeToken(TokenType.LINE_TERMINATOR);
        }

        if (c == '/' && peekChar(1) == '/') {
            while (position < source.length() && !isLineTerminator(peekChar(0))) {
                advance();
            }
            return makeToken(TokenType.SINGLE_LINE_COMMENT);
        }

        if (c == '/' && peekChar(1) == '*') {
            return blockComment();
        }

        if (c == '"' || c == '\'') {
            return string(c);
        }

        if (c == '@' && (peekChar(1) == '"' || peekChar(1) == '\'')) {
            return verbatimString();
        }

        if (c == '$' && peekChar(1) == '"') {
            advance();
            advance();
            templates.push(new TemplateFrame());
            return makeToken(TokenType.TEMPLATE_STRING_START);
        }

        if (c == '$' && isHexDigit(peekChar(1))) {
            advance();
            while (position < source.length() && (isHexDigit(peekChar(0)) || peekChar(0) == '_')) {
                advance();
            }
            return makeToken(TokenType.HEX_INTEGER_LITERAL);
        }

        if (isDigit(c) || (c == '.' && isDigit(peekChar(1)))) {
            return number();
        }

        if (isIdentifierStart(c)) {
            return identifierOrKeyword();
        }

        if (c == '#') {
            return directive();
        }

        if (frame != null && (c == '{' || c == '}')) {
            return templateBrace(frame, c);
        }

        for (Map.Entry<String, TokenType> operator : OPERATORS.entrySet()) {
            if (source.startsWith(operator.getKey(), position)) {
                for (int i = 0; i < operator.getKey().length(); i++) {
                    advance();
                }
                return makeToken(operator.getValue());
            }
        }

        if (c == '{') {
            advance();
            return makeToken(TokenType.OPEN_BRACE);
        }
        if (c == '}') {
            advance();
            return makeToken(TokenType.CLOSE_BRACE);
        }

        throw error(String.valueOf(c));
    }

    private Token blockComment() {
        advance();
        advance();
        while (position < source.length()) {
            if (peekChar(0) == '*' && peekChar(1) == '/') {
                advance();
                advance();
                return makeToken(TokenType.MULTI_LINE_COMMENT);
            }
            advance();
        }
        throw error(source.substring(tokenStart, position));
    }

    private Token string(char quote) {
        advance();
        while (position < source.length()) {
            char c = peekChar(0);
            if (isLineTerminator(c)) {
                break;
            }
            if (c == '\\' && position + 1 < source.length()) {
                advance();
                advance();
                continue;
            }
            advance();
            if (c == quote) {
                return makeToken(TokenType.STRING_LITERAL);
            }
        }
        throw error(source.substring(tokenStart, position));
    }

    private Token verbatimString() {
        advance();
        char quote = peekChar(0);
        advance();
        while (position < source.length()) {
            char c = advance();
            if (c == quote) {
                return makeToken(TokenType.VERBATIM_STRING_LITERAL);
            }
        }
        throw error(source.substring(tokenStart, position));
    }

    private Token templateText(TemplateFrame frame) {
        char c = peekChar(0);
        if (c == '"') {
            advance();
            templates.pop();
            return makeToken(TokenType.TEMPLATE_STRING_END);
        }
        if (c == '{') {
            advance();
            frame.inText = false;
            frame.braceDepth = 0;
            return makeToken(TokenType.TEMPLATE_STRING_START_EXPRESSION);
        }
        while (position < source.length()) {
            char next = peekChar(0);
            if (next == '"' || next == '{' || isLineTerminator(next)) {
                break;
            }
            if (next == '\\' && position + 1 < source.length() && !isLineTerminator(peekChar(1))) {
                advance();
            }
            advance();
        }
        if (position == tokenStart || position >= source.length() || isLineTerminator(peekChar(0))) {
            throw error(source.substring(tokenStart, position));
        }
        return makeToken(TokenType.TEMPLATE_STRING_TEXT);
    }

    private Token templateBrace(TemplateFrame frame, char c) {
        advance();
        if (c == '{') {
            frame.braceDepth++;
            return makeToken(TokenType.OPEN_BRACE);
        }
        if (frame.braceDepth == 0) {
            frame.inText = true;
            return makeToken(TokenType.TEMPLATE_STRING_END_EXPRESSION);
        }
        frame.braceDepth--;
        return makeToken(TokenType.CLOSE_BRACE);
    }

    private Token number() {
        char c = peekChar(0);
        if (c == '0' && (peekChar(1) == 'x' || peekChar(1) == 'X') && isHexDigit(peekChar(2))) {
            advance();
            advance();
            while (position < source.length() && (isHexDigit(peekChar(0)) || peekChar(0) == '_')) {
                advance();
            }
            return makeToken(TokenType.HEX_INTEGER_LITERAL);
        }
        if (c == '0' && (peekChar(1) == 'b' || peekChar(1) == 'B') && isBinaryDigit(peekChar(2))) {
            advance();
            advance();
            while (position < source.length() && (isBinaryDigit(peekChar(0)) || peekChar(0) == '_')) {
                advance();
            }
            return makeToken(TokenType.BINARY_LITERAL);
        }

        boolean decimal = false;
        while (position < source.length() && (isDigit(peekChar(0)) || peekChar(0) == '_')) {
            advance();
        }
        if (peekChar(0) == '.' && isDigit(peekChar(1))) {
            decimal = true;
            advance();
            while (position < source.length() && (isDigit(peekChar(0)) || peekChar(0) == '_')) {
                advance();
            }
        }
        return makeToken(decimal ? TokenType.DECIMAL_LITERAL : TokenType.INTEGER_LITERAL);
    }

    private Token identifierOrKeyword() {
        while (position < source.length() && isIdentifierPart(peekChar(0))) {
            advance();
        }
        String text = source.substring(tokenStart, position);
        return makeToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private Token directive() {
        advance();
        while (position < source.length() && isIdentifierPart(peekChar(0))) {
            advance();
        }
        String text = source.substring(tokenStart, position);
        TokenType type = DIRECTIVES.get(text);
        if (type == null) {
            throw error(text);
        }
        regionTextPending = type != TokenType.MACRO;
        return makeToken(type);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void markStart() {
        tokenStart = position;
        tokenLine = line;
        tokenColumn = column;
    }

    private Token makeToken(TokenType type) {
        String text = source.substring(tokenStart, position);
        return new Token(type, text, tokenLine, tokenColumn, tokenStart, position - 1);
    }

    private char peekChar(int offset) {
        int index = position + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private char advance() {
        char c = source.charAt(position++);
        if (c == '\n' || c == '\u2028' || c == '\u2029') {
            line++;
            column = 0;
        } else if (c == '\r') {
            if (peekChar(0) == '\n') {
                column++;
            } else {
                line++;
                column = 0;
            }
        } else {
            column++;
        }
        return c;
    }

    private RecognitionException error(String text) {
        String message = "token recognition error at: '" + escapeWhitespace(text) + "'";
        for (SyntaxErrorListener listener : List.copyOf(listeners)) {
            listener.syntaxError(this, null, tokenLine, tokenColumn, message);
        }
        return new RecognitionException(message, null, tokenLine, tokenColumn);
    }

    private static String escapeWhitespace(String text) {
        return text.replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
    }

    private static boolean isInlineWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\u000B' || c == '\u000C' || c == '\u00A0' || c == '\uFEFF';
    }

    static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isBinaryDigit(char c) {
        return c == '0' || c == '1';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
