package com.gmlparser.diagnostics;

/**
 * The one error a failed parse produces: invalid source, reported with enough position and
 * rule detail to render an editor diagnostic.
 */
public class GmlSyntaxError extends RuntimeException {
    public static final String NAME = "SyntaxError";

    private final Integer line;
    private final Integer column;
    private final String wrongSymbol;
    private final String offendingText;
    private final String rule;

    public GmlSyntaxError(String message, Integer line, Integer column, String wrongSymbol,
                          String offendingText, String rule) {
        this(message, line, column, wrongSymbol, offendingText, rule, null);
    }

    public GmlSyntaxError(String message, Integer line, Integer column, String wrongSymbol,
                          String offendingText, String rule, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
        this.wrongSymbol = wrongSymbol;
        this.offendingText = offendingText;
        this.rule = rule;
    }

    public String getName() {
        return NAME;
    }

    /**
     * 1-based line of the offending token, or {@code null} when unknown.
     */
    public Integer getLine() {
        return line;
    }

    /**
     * 0-based column of the offending token, or {@code null} when unknown.
     */
    public Integer getColumn() {
        return column;
    }

    /**
     * Human-readable description of the offending token, e.g. {@code symbol ')'} or
     * {@code end of file}.
     */
    public String getWrongSymbol() {
        return wrongSymbol;
    }

    public String getOffendingText() {
        return offendingText;
    }

    /**
     * Grammar rule being matched when the error was raised; {@code null} for lexer errors.
     */
    public String getRule() {
        return rule;
    }
}
