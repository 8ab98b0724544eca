package com.gmlparser.ast;

public record RepeatStatement(
    Location start,
    Location end,
    Expression test,
    Statement body
) implements Statement {
    public RepeatStatement(Span span, Expression test, Statement body) {
        this(span.start(), span.end(), test, body);
    }

    @Override
    public String type() {
        return "RepeatStatement";
    }
}
