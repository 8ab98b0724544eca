package com.gmlparser.grammar;

public enum TokenType {
    // Identifiers and literals
    IDENTIFIER,
    INTEGER_LITERAL,
    DECIMAL_LITERAL,
    HEX_INTEGER_LITERAL,
    BINARY_LITERAL,
    STRING_LITERAL,
    VERBATIM_STRING_LITERAL,
    BOOLEAN_LITERAL,
    UNDEFINED_LITERAL,
    NOONE_LITERAL,

    // Template strings: $"text {expr} text"
    TEMPLATE_STRING_START,
    TEMPLATE_STRING_TEXT,
    TEMPLATE_STRING_START_EXPRESSION,
    TEMPLATE_STRING_END_EXPRESSION,
    TEMPLATE_STRING_END,

    // Keywords
    IF, THEN, ELSE, DO, UNTIL, WHILE, FOR, REPEAT, WITH, SWITCH, CASE, DEFAULT,
    BREAK, CONTINUE, EXIT, RETURN, THROW, TRY, CATCH, FINALLY, DELETE, NEW,
    VAR, STATIC, GLOBALVAR, FUNCTION, CONSTRUCTOR, ENUM,

    // Punctuation ({ and begin both lex as OPEN_BRACE, } and end as CLOSE_BRACE)
    OPEN_BRACE, CLOSE_BRACE, OPEN_PAREN, CLOSE_PAREN,
    OPEN_BRACKET, LIST_ACCESSOR, MAP_ACCESSOR, GRID_ACCESSOR, ARRAY_ACCESSOR, STRUCT_ACCESSOR,
    CLOSE_BRACKET, SEMICOLON, COMMA, DOT, COLON, QUESTION_MARK, BACKSLASH,

    // Operators
    ASSIGN, COLON_ASSIGN,
    PLUS_PLUS, MINUS_MINUS, PLUS, MINUS, BIT_NOT, NOT,
    MULTIPLY, DIVIDE, INTEGER_DIVIDE, MODULUS,
    LEFT_SHIFT, RIGHT_SHIFT,
    LESS_THAN, GREATER_THAN, LESS_THAN_EQUALS, GREATER_THAN_EQUALS, EQUALS, NOT_EQUALS,
    BIT_AND, BIT_XOR, BIT_OR, AND, OR, NULL_COALESCE,
    MULTIPLY_ASSIGN, DIVIDE_ASSIGN, MODULUS_ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN,
    LEFT_SHIFT_ASSIGN, RIGHT_SHIFT_ASSIGN, BIT_AND_ASSIGN, BIT_XOR_ASSIGN, BIT_OR_ASSIGN,
    NULL_COALESCE_ASSIGN,

    // Preprocessor directives
    MACRO, DEFINE, REGION, END_REGION, REGION_CHARACTERS,

    // Hidden channel
    SINGLE_LINE_COMMENT(true),
    MULTI_LINE_COMMENT(true),
    WHITESPACE(true),
    LINE_TERMINATOR(true),

    EOF;

    private final boolean hidden;

    TokenType() {
        this(false);
    }

    TokenType(boolean hidden) {
        this.hidden = hidden;
    }

    public boolean isHidden() {
        return hidden;
    }

    public boolean isComment() {
        return this == SINGLE_LINE_COMMENT || this == MULTI_LINE_COMMENT;
    }

    public boolean isWhitespace() {
        return this == WHITESPACE || this == LINE_TERMINATOR;
    }

    public boolean isAssignmentOperator() {
        return switch (this) {
            case ASSIGN, COLON_ASSIGN, MULTIPLY_ASSIGN, DIVIDE_ASSIGN, MODULUS_ASSIGN, PLUS_ASSIGN,
                 MINUS_ASSIGN, LEFT_SHIFT_ASSIGN, RIGHT_SHIFT_ASSIGN, BIT_AND_ASSIGN, BIT_XOR_ASSIGN,
                 BIT_OR_ASSIGN, NULL_COALESCE_ASSIGN -> true;
            default -> false;
        };
    }

    public boolean isAccessor() {
        return switch (this) {
            case OPEN_BRACKET, LIST_ACCESSOR, MAP_ACCESSOR, GRID_ACCESSOR, ARRAY_ACCESSOR, STRUCT_ACCESSOR -> true;
            default -> false;
        };
    }
}
