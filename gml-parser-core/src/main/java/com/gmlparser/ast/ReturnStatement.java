package com.gmlparser.ast;

public record ReturnStatement(
    Location start,
    Location end,
    Expression argument  // Can be null
) implements Statement {
    public ReturnStatement(Span span, Expression argument) {
        this(span.start(), span.end(), argument);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }
}
