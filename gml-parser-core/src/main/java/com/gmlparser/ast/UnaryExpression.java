package com.gmlparser.ast;

public record UnaryExpression(
    Location start,
    Location end,
    String operator,
    boolean prefix,
    Expression argument
) implements Expression {
    public UnaryExpression(Span span, String operator, boolean prefix, Expression argument) {
        this(span.start(), span.end(), operator, prefix, argument);
    }

    @Override
    public String type() {
        return "UnaryExpression";
    }
}
