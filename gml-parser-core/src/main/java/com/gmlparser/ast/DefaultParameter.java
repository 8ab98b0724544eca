package com.gmlparser.ast;

public record DefaultParameter(
    Location start,
    Location end,
    Identifier left,
    Expression right
) implements Expression {
    public DefaultParameter(Span span, Identifier left, Expression right) {
        this(span.start(), span.end(), left, right);
    }

    @Override
    public String type() {
        return "DefaultParameter";
    }
}
