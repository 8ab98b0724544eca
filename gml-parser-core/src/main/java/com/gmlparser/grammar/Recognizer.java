package com.gmlparser.grammar;

import java.util.List;

/**
 * The part of the lexer and parser that error listeners are allowed to see.
 */
public interface Recognizer {

    /**
     * Rule names from the innermost active rule outwards. Empty for the lexer.
     */
    List<String> getRuleInvocationStack();

    /**
     * The rule context being matched when the error was raised, or {@code null} for the lexer.
     */
    ParseNode getContext();

    void addErrorListener(SyntaxErrorListener listener);

    void removeErrorListeners();
}
