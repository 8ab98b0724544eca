package com.gmlparser.ast;

public record ParenthesizedExpression(
    Location start,
    Location end,
    Expression expression,
    boolean synthetic  // true when inserted to keep operator grouping
) implements Expression {
    public ParenthesizedExpression(Span span, Expression expression, boolean synthetic) {
        this(span.start(), span.end(), expression, synthetic);
    }

    @Override
    public String type() {
        return "ParenthesizedExpression";
    }
}
