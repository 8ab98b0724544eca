package com.gmlparser.grammar;

/**
 * A lexed token. {@code line} is 1-based, {@code column} is 0-based and
 * {@code stopIndex} is inclusive, so an empty token has {@code stopIndex == startIndex - 1}.
 */
public record Token(
    TokenType type,
    String text,
    int line,
    int column,
    int startIndex,
    int stopIndex
) {
    public static final String EOF_TEXT = "<EOF>";

    public boolean isHidden() {
        return type.isHidden();
    }

    public boolean isEof() {
        return type == TokenType.EOF;
    }

    @Override
    public String toString() {
        return type + "('" + text + "' @" + line + ":" + column + ")";
    }
}
