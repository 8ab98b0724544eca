package com.gmlparser.grammar;

/**
 * Raised by the lexer or parser after listeners have been notified of a failure.
 * Listeners normally throw their own exception first; this is what escapes when none is registered.
 */
public class RecognitionException extends RuntimeException {
    private final Token offendingToken;
    private final int line;
    private final int column;

    public RecognitionException(String message, Token offendingToken, int line, int column) {
        super(message);
        this.offendingToken = offendingToken;
        this.line = line;
        this.column = column;
    }

    public Token getOffendingToken() {
        return offendingToken;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
