package com.gmlparser.ast;

/**
 * Assignment. {@code :=} is normalized to {@code =}.
 */
public record AssignmentExpression(
    Location start,
    Location end,
    String operator,
    Expression left,
    Expression right
) implements Statement, Expression {
    public AssignmentExpression(Span span, String operator, Expression left, Expression right) {
        this(span.start(), span.end(), operator, left, right);
    }

    @Override
    public String type() {
        return "AssignmentExpression";
    }
}
