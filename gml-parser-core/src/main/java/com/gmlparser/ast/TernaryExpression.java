package com.gmlparser.ast;

public record TernaryExpression(
    Location start,
    Location end,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {
    public TernaryExpression(Span span, Expression test, Expression consequent, Expression alternate) {
        this(span.start(), span.end(), test, consequent, alternate);
    }

    @Override
    public String type() {
        return "TernaryExpression";
    }
}
