package com.gmlparser.ast;

public record ThrowStatement(
    Location start,
    Location end,
    Expression argument
) implements Statement {
    public ThrowStatement(Span span, Expression argument) {
        this(span.start(), span.end(), argument);
    }

    @Override
    public String type() {
        return "ThrowStatement";
    }
}
