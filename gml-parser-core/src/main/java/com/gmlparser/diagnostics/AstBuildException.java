package com.gmlparser.diagnostics;

/**
 * The AST builder met a parse tree shape it does not expect. This is a bug in the parser
 * or builder, not in the source being parsed.
 */
public class AstBuildException extends RuntimeException {

    public AstBuildException(String message) {
        super(message);
    }

    public AstBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
