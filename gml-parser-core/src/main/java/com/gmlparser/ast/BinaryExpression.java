package com.gmlparser.ast;

public record BinaryExpression(
    Location start,
    Location end,
    String operator,
    Expression left,
    Expression right
) implements Expression {
    public BinaryExpression(Span span, String operator, Expression left, Expression right) {
        this(span.start(), span.end(), operator, left, right);
    }

    @Override
    public String type() {
        return "BinaryExpression";
    }
}
