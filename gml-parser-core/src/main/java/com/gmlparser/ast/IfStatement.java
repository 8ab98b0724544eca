package com.gmlparser.ast;

public record IfStatement(
    Location start,
    Location end,
    Expression test,
    Statement consequent,
    Statement alternate  // Can be null
) implements Statement {
    public IfStatement(Span span, Expression test, Statement consequent, Statement alternate) {
        this(span.start(), span.end(), test, consequent, alternate);
    }

    @Override
    public String type() {
        return "IfStatement";
    }
}
