package com.gmlparser.ast;

public record WithStatement(
    Location start,
    Location end,
    Expression test,
    Statement body
) implements Statement {
    public WithStatement(Span span, Expression test, Statement body) {
        this(span.start(), span.end(), test, body);
    }

    @Override
    public String type() {
        return "WithStatement";
    }
}
