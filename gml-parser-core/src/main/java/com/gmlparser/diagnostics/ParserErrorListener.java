package com.gmlparser.diagnostics;

import com.gmlparser.grammar.Recognizer;
import com.gmlparser.grammar.SyntaxErrorListener;

/**
 * Fails fast on the first parser error with a rule-aware {@link GmlSyntaxError}.
 */
public class ParserErrorListener implements SyntaxErrorListener {

    @Override
    public void syntaxError(Recognizer recognizer, Object offendingSymbol, int line, int column, String message) {
        throw SyntaxErrorFormatter.parserError(recognizer, offendingSymbol, line, column, message);
    }
}
