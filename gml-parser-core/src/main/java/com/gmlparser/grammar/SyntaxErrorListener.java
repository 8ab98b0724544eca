package com.gmlparser.grammar;

/**
 * Receives recognition failures from the lexer and the parser.
 *
 * <p>{@code offendingSymbol} is the {@link Token} for parser errors and {@code null}
 * for lexer errors, where the raw message carries the offending text instead.</p>
 */
@FunctionalInterface
public interface SyntaxErrorListener {

    void syntaxError(Recognizer recognizer, Object offendingSymbol, int line, int column, String message);
}
