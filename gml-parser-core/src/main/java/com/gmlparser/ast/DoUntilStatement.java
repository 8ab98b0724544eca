package com.gmlparser.ast;

public record DoUntilStatement(
    Location start,
    Location end,
    Statement body,
    Expression test
) implements Statement {
    public DoUntilStatement(Span span, Statement body, Expression test) {
        this(span.start(), span.end(), body, test);
    }

    @Override
    public String type() {
        return "DoUntilStatement";
    }
}
