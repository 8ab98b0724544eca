package com.gmlparser.ast;

public record ExpressionStatement(
    Location start,
    Location end,
    Expression expression
) implements Statement {
    public ExpressionStatement(Span span, Expression expression) {
        this(span.start(), span.end(), expression);
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
