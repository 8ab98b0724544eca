package com.gmlparser.ast;

public record DeleteStatement(
    Location start,
    Location end,
    String operator,
    Expression argument
) implements Statement {
    public DeleteStatement(Span span, String operator, Expression argument) {
        this(span.start(), span.end(), operator, argument);
    }

    @Override
    public String type() {
        return "DeleteStatement";
    }
}
