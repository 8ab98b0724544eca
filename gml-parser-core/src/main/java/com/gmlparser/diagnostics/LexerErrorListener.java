package com.gmlparser.diagnostics;

import com.gmlparser.grammar.Recognizer;
import com.gmlparser.grammar.SyntaxErrorListener;

public class LexerErrorListener implements SyntaxErrorListener {

    @Override
    public void syntaxError(Recognizer recognizer, Object offendingSymbol, int line, int column, String message) {
        throw SyntaxErrorFormatter.lexerError(offendingSymbol, line, column, message);
    }
}
